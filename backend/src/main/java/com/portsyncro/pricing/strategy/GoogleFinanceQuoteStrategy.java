package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.fetch.ClientHeaderPool;
import com.portsyncro.pricing.fetch.RawResponse;
import com.portsyncro.pricing.fetch.SourceFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes the Google Finance quote page of an IDX listing. The page markup has no contract, so every
 * extraction is best effort: price from the main quote element, change computed from the previous close,
 * then an inline percentage near the price, then zero.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleFinanceQuoteStrategy implements PriceStrategy {

    private static final Pattern PRICE = Pattern.compile("class=\"YMlKec fxKbKc\"[^>]*>([^<]+)<");
    private static final Pattern PREVIOUS_CLOSE_VALUE = Pattern.compile(
            "Previous close.{0,600}?class=\"P6K39c\"[^>]*>([^<]+)<", Pattern.DOTALL);
    private static final Pattern PREVIOUS_CLOSE_NEXT = Pattern.compile(
            "Previous close\\s*</\\w+>\\s*(?:<[^>]+>\\s*)*?<div[^>]*>([^<]+)<", Pattern.DOTALL);
    private static final Pattern CHANGE_LABELLED = Pattern.compile("(Up|Down) by\\s*([0-9.,]+)%");
    private static final Pattern CHANGE_INLINE = Pattern.compile("([+\\-\\u2212]?[0-9]{1,3}(?:[.,][0-9]+)?)\\s*%");
    private static final int CHANGE_SEARCH_CHARS = 1500;

    private final PricingProperties pricingProperties;
    private final SourceFetcher sourceFetcher;
    private final ClientHeaderPool clientHeaderPool;
    private final Clock clock;

    @Override
    public PriceSource source() {
        return PriceSource.GOOGLE_FINANCE;
    }

    @Override
    public Optional<ResolvedPrice> fetch(InstrumentId instrumentId) {
        if (!instrumentId.isDomesticEquity()) {
            return Optional.empty();
        }
        String url = pricingProperties.getGoogleFinanceBaseUrl() + "/quote/" + Quotes.encode(instrumentId.googleSymbol());
        RawResponse response = sourceFetcher.fetch(url, clientHeaderPool.forHtml(),
                Duration.ofMillis(pricingProperties.getFetchTimeoutMs()));
        return parseQuotePage(response.body())
                .map(q -> ResolvedPrice.of(q.price(), PriceCurrency.IDR, q.changePercent(), source(), clock.instant()));
    }

    static Optional<ScrapedQuote> parseQuotePage(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Matcher priceMatcher = PRICE.matcher(html);
        if (!priceMatcher.find()) {
            return Optional.empty();
        }
        Optional<BigDecimal> price = Quotes.displayedNumber(priceMatcher.group(1)).filter(p -> p.signum() > 0);
        if (price.isEmpty()) {
            return Optional.empty();
        }
        Optional<BigDecimal> previousClose = previousClose(html);
        if (previousClose.isPresent()) {
            return Optional.of(new ScrapedQuote(price.get(), ResolvedPrice.percentChange(price.get(), previousClose.get())));
        }
        int from = priceMatcher.end();
        String nearPrice = html.substring(from, Math.min(html.length(), from + CHANGE_SEARCH_CHARS));
        BigDecimal change = inlineChange(nearPrice).orElse(BigDecimal.ZERO);
        return Optional.of(new ScrapedQuote(price.get(), change));
    }

    private static Optional<BigDecimal> previousClose(String html) {
        for (Pattern pattern : new Pattern[]{PREVIOUS_CLOSE_VALUE, PREVIOUS_CLOSE_NEXT}) {
            Matcher m = pattern.matcher(html);
            if (m.find()) {
                Optional<BigDecimal> value = Quotes.displayedNumber(m.group(1)).filter(v -> v.signum() > 0);
                if (value.isPresent()) {
                    return value;
                }
            }
        }
        return Optional.empty();
    }

    static Optional<BigDecimal> inlineChange(String text) {
        Matcher labelled = CHANGE_LABELLED.matcher(text);
        if (labelled.find()) {
            Optional<BigDecimal> value = Quotes.displayedNumber(labelled.group(2));
            return value.map(v -> "Down".equals(labelled.group(1)) ? v.negate() : v);
        }
        Matcher inline = CHANGE_INLINE.matcher(text);
        if (inline.find()) {
            String raw = inline.group(1).replace('−', '-').replace(',', '.');
            try {
                return Optional.of(new BigDecimal(raw));
            } catch (NumberFormatException e) {
                log.debug("Unparseable inline change '{}'", raw);
            }
        }
        return Optional.empty();
    }

    record ScrapedQuote(BigDecimal price, BigDecimal changePercent) {}
}
