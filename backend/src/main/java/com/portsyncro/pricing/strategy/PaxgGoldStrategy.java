package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.ExchangeRate;
import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.ExchangeRateService;
import com.portsyncro.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;

/**
 * Fallback gold price when the IndoGold page is unavailable: the proxy token (one troy ounce) in USD,
 * converted to IDR per gram at the current rate.
 */
@Component
@RequiredArgsConstructor
public class PaxgGoldStrategy implements PriceStrategy {

    static final BigDecimal GRAMS_PER_TROY_OUNCE = new BigDecimal("31.1034768");

    private final PricingProperties pricingProperties;
    private final CryptoCompareFullStrategy cryptoCompareFullStrategy;
    private final ExchangeRateService exchangeRateService;
    private final GoldPremiums goldPremiums;
    private final Clock clock;

    @Override
    public PriceSource source() {
        return PriceSource.PAXG_PROXY;
    }

    @Override
    public Optional<ResolvedPrice> fetch(InstrumentId instrumentId) {
        Optional<ResolvedPrice> proxy = cryptoCompareFullStrategy.fetchSymbol(pricingProperties.getGold().getProxySymbol());
        if (proxy.isEmpty()) {
            return Optional.empty();
        }
        ExchangeRate rate = exchangeRateService.currentRate();
        if (!rate.isUsable()) {
            return Optional.empty();
        }
        BigDecimal perGram = idrPerGram(proxy.get().price(), rate.rate()).add(goldPremiums.premiumFor(instrumentId));
        return Optional.of(ResolvedPrice.of(perGram, PriceCurrency.IDR, proxy.get().changePercent(), source(), clock.instant()));
    }

    static BigDecimal idrPerGram(BigDecimal usdPerOunce, BigDecimal idrPerUsd) {
        return usdPerOunce.multiply(idrPerUsd).divide(GRAMS_PER_TROY_OUNCE, 0, RoundingMode.HALF_UP);
    }
}
