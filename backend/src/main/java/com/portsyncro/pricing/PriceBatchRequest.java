package com.portsyncro.pricing;

import java.util.List;

/**
 * Instruments requested in one batch, by category. Null lists are treated as empty.
 *
 * @param stocks equities; {@code .JK} / {@code :IDX} suffix marks IDX listings
 * @param crypto crypto symbols
 * @param gold   gold ids ({@code GOLD}, {@code GOLD:<BRAND>})
 */
public record PriceBatchRequest(List<String> stocks, List<String> crypto, List<String> gold) {

    public PriceBatchRequest {
        stocks = stocks == null ? List.of() : stocks;
        crypto = crypto == null ? List.of() : crypto;
        gold = gold == null ? List.of() : gold;
    }

    public boolean isEmpty() {
        return stocks.isEmpty() && crypto.isEmpty() && gold.isEmpty();
    }
}
