package com.portsyncro.pricing.strategy;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.Locale;
import java.util.Optional;

/**
 * CryptoCompare full detail (/data/pricemultifull): USD price with 24h change.
 */
@Component
@RequiredArgsConstructor
public class CryptoCompareFullStrategy implements PriceStrategy {

    private final PricingProperties pricingProperties;
    private final SourceFetcher sourceFetcher;
    private final ClientHeaderPool clientHeaderPool;
    private final RateLimiter cryptocompareThrottle;
    private final Clock clock;

    @Override
    public PriceSource source() {
        return PriceSource.CRYPTOCOMPARE_FULL;
    }

    @Override
    public Optional<ResolvedPrice> fetch(InstrumentId instrumentId) {
        return fetchSymbol(instrumentId.symbol());
    }

    /** Also used by the gold strategies for the proxy symbol. */
    public Optional<ResolvedPrice> fetchSymbol(String symbol) {
        String sym = symbol.toUpperCase(Locale.ROOT);
        String url = pricingProperties.getCryptocompareBaseUrl() + "/data/pricemultifull?fsyms="
                + Quotes.encode(sym) + "&tsyms=USD";
        RawResponse response = sourceFetcher.fetch(url, clientHeaderPool.forJson(),
                Duration.ofMillis(pricingProperties.getFetchTimeoutMs()), cryptocompareThrottle);
        return parseFull(response.body(), sym)
                .map(q -> ResolvedPrice.of(q.price(), PriceCurrency.USD, q.changePercent(), source(), clock.instant()));
    }

    static Optional<FullQuote> parseFull(String json, String symbol) {
        return Quotes.readTree(json).flatMap(root -> {
            JsonNode usd = root.path("RAW").path(symbol).path("USD");
            return Quotes.positive(usd.path("PRICE")).map(price -> new FullQuote(price,
                    Quotes.number(usd.path("CHANGEPCT24HOUR")).orElse(BigDecimal.ZERO)));
        });
    }

    record FullQuote(BigDecimal price, BigDecimal changePercent) {}
}
