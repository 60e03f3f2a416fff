package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.fetch.ClientHeaderPool;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CryptoCompareStrategiesTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-15T03:00:00Z"), ZoneOffset.UTC);
    private static final ClientHeaderPool HEADERS = new ClientHeaderPool(List.of("test-agent"));

    @Test
    @DisplayName("full detail: USD price and 24h change")
    void parseFull() {
        String json = "{\"RAW\":{\"BTC\":{\"USD\":{\"PRICE\":50000,\"CHANGEPCT24HOUR\":2.5}}}}";

        CryptoCompareFullStrategy.FullQuote quote = CryptoCompareFullStrategy.parseFull(json, "BTC").orElseThrow();

        assertThat(quote.price()).isEqualByComparingTo("50000");
        assertThat(quote.changePercent()).isEqualByComparingTo("2.5");
    }

    @Test
    @DisplayName("full detail: unknown symbol or error payload yields nothing")
    void parseFullMissing() {
        assertThat(CryptoCompareFullStrategy.parseFull("{\"RAW\":{}}", "BTC")).isEmpty();
        assertThat(CryptoCompareFullStrategy.parseFull("{\"Response\":\"Error\",\"Message\":\"no data\"}", "XYZ")).isEmpty();
    }

    @Test
    @DisplayName("spot: price with zero change")
    void spot() {
        StubUpstream upstream = new StubUpstream().route("/data/price?fsym=DOGE", "{\"USD\":0.1234}");
        CryptoCompareSpotStrategy strategy = new CryptoCompareSpotStrategy(new PricingProperties(), upstream.fetcher(),
                HEADERS, RateLimiter.ofDefaults("test"), CLOCK);

        ResolvedPrice price = strategy.fetch(InstrumentId.of("doge")).orElseThrow();

        assertThat(price.price()).isEqualByComparingTo("0.1234");
        assertThat(price.changePercent()).isEqualByComparingTo("0");
        assertThat(price.currency()).isEqualTo(PriceCurrency.USD);
        assertThat(price.source()).isEqualTo(PriceSource.CRYPTOCOMPARE_SPOT);
    }

    @Test
    @DisplayName("full detail fetch upper-cases the symbol")
    void fetchFull() {
        StubUpstream upstream = new StubUpstream().route("fsyms=ETH&tsyms=USD",
                "{\"RAW\":{\"ETH\":{\"USD\":{\"PRICE\":3500.25,\"CHANGEPCT24HOUR\":-0.456}}}}");
        CryptoCompareFullStrategy strategy = new CryptoCompareFullStrategy(new PricingProperties(), upstream.fetcher(),
                HEADERS, RateLimiter.ofDefaults("test"), CLOCK);

        ResolvedPrice price = strategy.fetch(InstrumentId.of("eth")).orElseThrow();

        assertThat(price.price()).isEqualByComparingTo("3500.25");
        assertThat(price.changePercent()).isEqualByComparingTo("-0.46");
        assertThat(price.source()).isEqualTo(PriceSource.CRYPTOCOMPARE_FULL);
    }
}
