package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Per-gram premium over spot for physical bar brands. Unknown brands and spot gold get no premium.
 */
@Component
@RequiredArgsConstructor
public class GoldPremiums {

    private final PricingProperties pricingProperties;

    public BigDecimal premiumFor(InstrumentId instrumentId) {
        return instrumentId.goldBrand()
                .map(brand -> lookup(pricingProperties.getGold().getBrandPremiums(), brand))
                .orElse(BigDecimal.ZERO);
    }

    private static BigDecimal lookup(Map<String, BigDecimal> premiums, String brand) {
        if (premiums == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal premium = premiums.get(brand.toUpperCase(Locale.ROOT));
        return premium != null ? premium : BigDecimal.ZERO;
    }
}
