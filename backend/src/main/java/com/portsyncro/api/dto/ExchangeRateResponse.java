package com.portsyncro.api.dto;

import com.portsyncro.domain.ExchangeRate;

import java.math.BigDecimal;
import java.time.Instant;

public record ExchangeRateResponse(BigDecimal rate, String source, Instant timestamp) {

    public static ExchangeRateResponse from(ExchangeRate rate) {
        return new ExchangeRateResponse(rate.rate(), rate.source(), rate.timestamp());
    }
}
