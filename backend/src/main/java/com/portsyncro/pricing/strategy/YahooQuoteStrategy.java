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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Structured quote endpoint (/v7/finance/quote). Price, currency and percent change come straight from the payload.
 */
@Component
@RequiredArgsConstructor
public class YahooQuoteStrategy implements PriceStrategy {

    private final PricingProperties pricingProperties;
    private final SourceFetcher sourceFetcher;
    private final ClientHeaderPool clientHeaderPool;
    private final Clock clock;

    @Override
    public PriceSource source() {
        return PriceSource.YAHOO_QUOTE;
    }

    @Override
    public Optional<ResolvedPrice> fetch(InstrumentId instrumentId) {
        String symbol = instrumentId.yahooSymbol();
        String url = pricingProperties.getYahooQuoteBaseUrl() + "/v7/finance/quote?symbols=" + Quotes.encode(symbol);
        RawResponse response = sourceFetcher.fetch(url, clientHeaderPool.forJson(),
                Duration.ofMillis(pricingProperties.getFetchTimeoutMs()));
        return parseQuote(response.body())
                .map(q -> ResolvedPrice.of(q.price(), q.currency(), q.changePercent(), source(), clock.instant()));
    }

    static Optional<Quote> parseQuote(String json) {
        return Quotes.readTree(json).flatMap(root -> {
            JsonNode result = root.path("quoteResponse").path("result").path(0);
            if (result.isMissingNode()) {
                return Optional.empty();
            }
            return Quotes.positive(result.path("regularMarketPrice")).map(price -> new Quote(
                    price,
                    PriceCurrency.fromCode(result.path("currency").asText(null)),
                    Quotes.number(result.path("regularMarketChangePercent")).orElse(BigDecimal.ZERO)));
        });
    }

    record Quote(BigDecimal price, PriceCurrency currency, BigDecimal changePercent) {}
}
