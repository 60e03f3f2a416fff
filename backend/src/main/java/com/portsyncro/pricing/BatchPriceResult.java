package com.portsyncro.pricing;

import com.portsyncro.domain.ResolvedPrice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a batch. Prices are keyed by the caller's spelling of each instrument; instruments without a price are absent.
 */
public record BatchPriceResult(Map<String, ResolvedPrice> prices, boolean rejected, String identity) {

    public BatchPriceResult {
        prices = prices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(prices));
    }

    public static BatchPriceResult rejected(String identity) {
        return new BatchPriceResult(Map.of(), true, identity);
    }

    public static BatchPriceResult of(Map<String, ResolvedPrice> prices, String identity) {
        return new BatchPriceResult(prices, false, identity);
    }
}
