package com.portsyncro.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * USD/IDR rate: IDR per 1 USD. {@link #fallback(Instant)} is the documented offline mode, not an error.
 */
public record ExchangeRate(BigDecimal rate, String source, Instant timestamp) {

    public static final BigDecimal FALLBACK_RATE = new BigDecimal("16000");
    public static final String FALLBACK_SOURCE = "Fallback (Offline)";

    public static ExchangeRate fallback(Instant now) {
        return new ExchangeRate(FALLBACK_RATE, FALLBACK_SOURCE, now);
    }

    public boolean isFallback() {
        return FALLBACK_SOURCE.equals(source);
    }

    /** True when the rate can be used as a divisor. */
    public boolean isUsable() {
        return rate != null && rate.signum() > 0;
    }
}
