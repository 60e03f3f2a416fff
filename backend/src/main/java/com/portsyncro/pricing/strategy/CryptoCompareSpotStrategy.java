package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.fetch.ClientHeaderPool;
import com.portsyncro.pricing.fetch.RawResponse;
import com.portsyncro.pricing.fetch.SourceFetcher;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Simple spot endpoint (/data/price). No change data; reported change is zero.
 */
@Component
@RequiredArgsConstructor
public class CryptoCompareSpotStrategy implements PriceStrategy {

    private final PricingProperties pricingProperties;
    private final SourceFetcher sourceFetcher;
    private final ClientHeaderPool clientHeaderPool;
    private final RateLimiter cryptocompareThrottle;
    private final Clock clock;

    @Override
    public PriceSource source() {
        return PriceSource.CRYPTOCOMPARE_SPOT;
    }

    @Override
    public Optional<ResolvedPrice> fetch(InstrumentId instrumentId) {
        String url = pricingProperties.getCryptocompareBaseUrl() + "/data/price?fsym="
                + Quotes.encode(instrumentId.symbol()) + "&tsyms=USD";
        RawResponse response = sourceFetcher.fetch(url, clientHeaderPool.forJson(),
                Duration.ofMillis(pricingProperties.getFetchTimeoutMs()), cryptocompareThrottle);
        return parseSpot(response.body())
                .map(price -> ResolvedPrice.of(price, PriceCurrency.USD, BigDecimal.ZERO, source(), clock.instant()));
    }

    static Optional<BigDecimal> parseSpot(String json) {
        return Quotes.readTree(json).flatMap(root -> Quotes.positive(root.path("USD")));
    }
}
