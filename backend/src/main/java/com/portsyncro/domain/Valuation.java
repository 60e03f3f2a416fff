package com.portsyncro.domain;

import java.math.BigDecimal;

/**
 * Derived value of one position for one pricing cycle. IDR fields are whole units, USD fields 2 decimals.
 * With {@link ValuationError#PRICE_UNAVAILABLE} every monetary field is zero;
 * with {@link ValuationError#EXCHANGE_RATE_UNAVAILABLE} the bridged currency fields are zero.
 */
public record Valuation(
        BigDecimal valueIdr,
        BigDecimal valueUsd,
        BigDecimal costBasisIdr,
        BigDecimal gainIdr,
        BigDecimal gainUsd,
        BigDecimal gainPercent,
        BigDecimal priceUsed,
        ValuationError error
) {

    public static Valuation unavailable() {
        return new Valuation(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, ValuationError.PRICE_UNAVAILABLE);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isPriceUnavailable() {
        return error == ValuationError.PRICE_UNAVAILABLE;
    }
}
