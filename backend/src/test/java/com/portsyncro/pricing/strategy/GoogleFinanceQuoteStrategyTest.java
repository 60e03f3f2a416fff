package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.fetch.ClientHeaderPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GoogleFinanceQuoteStrategyTest {

    private static final String PAGE_WITH_PREVIOUS_CLOSE = """
            <html><body>
            <div class="rPF6Lc"><div class="YMlKec fxKbKc">Rp5,500.00</div></div>
            <div class="gyFHrc"><span class="mfs7Fc">Previous close</span>
            <div class="P6K39c">Rp5,000.00</div></div>
            </body></html>
            """;

    @Test
    @DisplayName("change is computed from the previous close when it is on the page")
    void changeFromPreviousClose() {
        Optional<GoogleFinanceQuoteStrategy.ScrapedQuote> quote =
                GoogleFinanceQuoteStrategy.parseQuotePage(PAGE_WITH_PREVIOUS_CLOSE);

        assertThat(quote).isPresent();
        assertThat(quote.get().price()).isEqualByComparingTo("5500");
        assertThat(quote.get().changePercent()).isEqualByComparingTo("10.00");
    }

    @Test
    @DisplayName("previous close in the following plain element is also recognised")
    void previousCloseInNextElement() {
        String html = "<div class=\"YMlKec fxKbKc\">5,250</div><div>Previous close</div><div>5,000</div>";

        assertThat(GoogleFinanceQuoteStrategy.parseQuotePage(html))
                .get()
                .satisfies(q -> assertThat(q.changePercent()).isEqualByComparingTo("5.00"));
    }

    @Test
    @DisplayName("without previous close an inline percentage near the price is used")
    void inlinePercentFallback() {
        String html = "<div class=\"YMlKec fxKbKc\">Rp9,100.00</div><span aria-label=\"Down by 1.25%\">1.25%</span>";

        assertThat(GoogleFinanceQuoteStrategy.parseQuotePage(html))
                .get()
                .satisfies(q -> assertThat(q.changePercent()).isEqualByComparingTo("-1.25"));
    }

    @Test
    @DisplayName("signed inline percentage is read as-is")
    void signedInlinePercent() {
        assertThat(GoogleFinanceQuoteStrategy.inlineChange("<span>+0.84%</span>")).contains(new BigDecimal("0.84"));
        assertThat(GoogleFinanceQuoteStrategy.inlineChange("<span>no change data</span>")).isEmpty();
    }

    @Test
    @DisplayName("change defaults to 0 when neither previous close nor percentage is found")
    void changeDefaultsToZero() {
        assertThat(GoogleFinanceQuoteStrategy.parseQuotePage("<div class=\"YMlKec fxKbKc\">Rp7,000.00</div>"))
                .get()
                .satisfies(q -> assertThat(q.changePercent()).isEqualByComparingTo("0"));
    }

    @Test
    @DisplayName("page without the price element yields no quote")
    void noPriceElement() {
        assertThat(GoogleFinanceQuoteStrategy.parseQuotePage("<html>captcha</html>")).isEmpty();
        assertThat(GoogleFinanceQuoteStrategy.parseQuotePage(null)).isEmpty();
    }

    @Test
    @DisplayName("fetch requests the :IDX page and returns an IDR price")
    void fetchDomestic() {
        StubUpstream upstream = new StubUpstream().route("/quote/BBCA%3AIDX", PAGE_WITH_PREVIOUS_CLOSE);
        GoogleFinanceQuoteStrategy strategy = strategy(upstream);

        Optional<ResolvedPrice> price = strategy.fetch(InstrumentId.of("bbca.jk"));

        assertThat(price).isPresent();
        assertThat(price.get().currency()).isEqualTo(PriceCurrency.IDR);
        assertThat(price.get().source()).isEqualTo(PriceSource.GOOGLE_FINANCE);
        assertThat(price.get().resolvedAt()).isEqualTo(Instant.parse("2025-01-15T03:00:00Z"));
        assertThat(upstream.requested).hasSize(1);
    }

    @Test
    @DisplayName("foreign equities are skipped without a request")
    void foreignSkipped() {
        StubUpstream upstream = new StubUpstream();
        assertThat(strategy(upstream).fetch(InstrumentId.of("AAPL"))).isEmpty();
        assertThat(upstream.requested).isEmpty();
    }

    private static GoogleFinanceQuoteStrategy strategy(StubUpstream upstream) {
        return new GoogleFinanceQuoteStrategy(new PricingProperties(), upstream.fetcher(),
                new ClientHeaderPool(List.of("test-agent")),
                Clock.fixed(Instant.parse("2025-01-15T03:00:00Z"), ZoneOffset.UTC));
    }
}
