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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chart endpoint (/v8/finance/chart). Change priority: chartPreviousClose, previousClose,
 * regularMarketChangePercent, then the last two daily closes (window "1d").
 */
@Component
@RequiredArgsConstructor
public class YahooChartStrategy implements PriceStrategy {

    private final PricingProperties pricingProperties;
    private final SourceFetcher sourceFetcher;
    private final ClientHeaderPool clientHeaderPool;
    private final Clock clock;

    @Override
    public PriceSource source() {
        return PriceSource.YAHOO_CHART;
    }

    @Override
    public Optional<ResolvedPrice> fetch(InstrumentId instrumentId) {
        String url = pricingProperties.getYahooChartBaseUrl() + "/v8/finance/chart/"
                + Quotes.encode(instrumentId.yahooSymbol()) + "?interval=1d&range=5d";
        RawResponse response = sourceFetcher.fetch(url, clientHeaderPool.forJson(),
                Duration.ofMillis(pricingProperties.getFetchTimeoutMs()));
        return parseChart(response.body()).map(c -> new ResolvedPrice(c.price(), c.currency(), c.changePercent(),
                c.changeWindow(), source(), clock.instant()));
    }

    static Optional<Chart> parseChart(String json) {
        return Quotes.readTree(json).flatMap(root -> {
            JsonNode result = root.path("chart").path("result").path(0);
            JsonNode meta = result.path("meta");
            Optional<BigDecimal> price = Quotes.positive(meta.path("regularMarketPrice"));
            if (price.isEmpty()) {
                return Optional.empty();
            }
            PriceCurrency currency = PriceCurrency.fromCode(meta.path("currency").asText(null));
            Optional<BigDecimal> previous = Quotes.positive(meta.path("chartPreviousClose"))
                    .or(() -> Quotes.positive(meta.path("previousClose")));
            if (previous.isPresent()) {
                return Optional.of(new Chart(price.get(), currency,
                        ResolvedPrice.percentChange(price.get(), previous.get()), ResolvedPrice.WINDOW_24H));
            }
            Optional<BigDecimal> reported = Quotes.number(meta.path("regularMarketChangePercent"));
            if (reported.isPresent()) {
                return Optional.of(new Chart(price.get(), currency, reported.get(), ResolvedPrice.WINDOW_24H));
            }
            List<BigDecimal> closes = new ArrayList<>();
            for (JsonNode close : result.path("indicators").path("quote").path(0).path("close")) {
                Quotes.positive(close).ifPresent(closes::add);
            }
            if (closes.size() >= 2) {
                BigDecimal current = closes.get(closes.size() - 1);
                BigDecimal prior = closes.get(closes.size() - 2);
                return Optional.of(new Chart(price.get(), currency,
                        ResolvedPrice.percentChange(current, prior), ResolvedPrice.WINDOW_1D));
            }
            return Optional.of(new Chart(price.get(), currency, BigDecimal.ZERO, ResolvedPrice.WINDOW_24H));
        });
    }

    record Chart(BigDecimal price, PriceCurrency currency, BigDecimal changePercent, String changeWindow) {}
}
