package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.fetch.ClientHeaderPool;
import com.portsyncro.pricing.fetch.FetchException;
import com.portsyncro.pricing.fetch.RawResponse;
import com.portsyncro.pricing.fetch.SourceFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gold in IDR per gram from the IndoGold daily price page. Spot is the scraped buy price plus the configured
 * markup; the 24h change is borrowed from the proxy crypto (PAXG) since the page carries none.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndoGoldStrategy implements PriceStrategy {

    private static final Pattern BUY_PRICE = Pattern.compile(
            "Harga Beli\\s*(?:<[^>]+>\\s*)*Rp\\.?\\s*([0-9.,]+)", Pattern.CASE_INSENSITIVE);

    private final PricingProperties pricingProperties;
    private final SourceFetcher sourceFetcher;
    private final ClientHeaderPool clientHeaderPool;
    private final CryptoCompareFullStrategy cryptoCompareFullStrategy;
    private final GoldPremiums goldPremiums;
    private final Clock clock;

    @Override
    public PriceSource source() {
        return PriceSource.INDOGOLD;
    }

    @Override
    public Optional<ResolvedPrice> fetch(InstrumentId instrumentId) {
        RawResponse response = sourceFetcher.fetch(pricingProperties.getIndogoldUrl(), clientHeaderPool.forHtml(),
                Duration.ofMillis(pricingProperties.getFetchTimeoutMs()));
        Optional<BigDecimal> buyPrice = parseBuyPrice(response.body());
        if (buyPrice.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal spot = spotPrice(buyPrice.get(), pricingProperties.getGold().getSpotMarkup());
        BigDecimal price = spot.add(goldPremiums.premiumFor(instrumentId));
        return Optional.of(ResolvedPrice.of(price, PriceCurrency.IDR, proxyChange(), source(), clock.instant()));
    }

    static Optional<BigDecimal> parseBuyPrice(String html) {
        if (html == null) {
            return Optional.empty();
        }
        Matcher m = BUY_PRICE.matcher(html);
        if (!m.find()) {
            return Optional.empty();
        }
        return Quotes.rupiah(m.group(1)).filter(v -> v.signum() > 0);
    }

    static BigDecimal spotPrice(BigDecimal buyPrice, BigDecimal markup) {
        BigDecimal factor = BigDecimal.ONE.add(markup != null ? markup : BigDecimal.ZERO);
        return buyPrice.multiply(factor).setScale(0, RoundingMode.HALF_UP);
    }

    private BigDecimal proxyChange() {
        try {
            return cryptoCompareFullStrategy.fetchSymbol(pricingProperties.getGold().getProxySymbol())
                    .map(ResolvedPrice::changePercent)
                    .orElse(BigDecimal.ZERO);
        } catch (FetchException e) {
            log.warn("Gold proxy change unavailable ({}), reporting 0", e.getReason());
            return BigDecimal.ZERO;
        }
    }
}
