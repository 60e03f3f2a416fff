package com.portsyncro.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Normalized price for one instrument in one resolution cycle. Immutable; the next cycle replaces it wholesale.
 *
 * @param price         last price in {@code currency}
 * @param currency      pricing currency
 * @param changePercent signed change over {@code changeWindow}, 2 decimal places
 * @param changeWindow  label of the change window ("24h" or "1d")
 * @param source        strategy that produced the price
 * @param resolvedAt    resolution time
 */
public record ResolvedPrice(
        BigDecimal price,
        PriceCurrency currency,
        BigDecimal changePercent,
        String changeWindow,
        PriceSource source,
        Instant resolvedAt
) {

    public static final String WINDOW_24H = "24h";
    public static final String WINDOW_1D = "1d";

    public ResolvedPrice {
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(resolvedAt, "resolvedAt");
        changePercent = (changePercent == null ? BigDecimal.ZERO : changePercent).setScale(2, RoundingMode.HALF_UP);
        changeWindow = changeWindow == null ? WINDOW_24H : changeWindow;
    }

    public static ResolvedPrice of(BigDecimal price, PriceCurrency currency, BigDecimal changePercent,
                                   PriceSource source, Instant resolvedAt) {
        return new ResolvedPrice(price, currency, changePercent, WINDOW_24H, source, resolvedAt);
    }

    /**
     * Percent change from {@code previous} to {@code current}; zero when previous is missing or not positive.
     */
    public static BigDecimal percentChange(BigDecimal current, BigDecimal previous) {
        if (current == null || previous == null || previous.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return current.subtract(previous)
                .multiply(BigDecimal.valueOf(100))
                .divide(previous, 2, RoundingMode.HALF_UP);
    }
}
