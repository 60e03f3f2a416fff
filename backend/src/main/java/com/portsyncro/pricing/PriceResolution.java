package com.portsyncro.pricing;

import com.portsyncro.domain.ResolvedPrice;

import java.util.Optional;

/**
 * Result of resolving one instrument: either a price from the first strategy that produced one, or UNAVAILABLE.
 */
public final class PriceResolution {

    private static final PriceResolution UNAVAILABLE = new PriceResolution(null);

    private final ResolvedPrice price;

    private PriceResolution(ResolvedPrice price) {
        this.price = price;
    }

    public static PriceResolution resolved(ResolvedPrice price) {
        return price == null ? UNAVAILABLE : new PriceResolution(price);
    }

    public static PriceResolution unavailable() {
        return UNAVAILABLE;
    }

    public boolean isUnavailable() {
        return price == null;
    }

    public Optional<ResolvedPrice> getPrice() {
        return Optional.ofNullable(price);
    }
}
