package com.portsyncro.domain;

/**
 * Why a valuation is not complete.
 * PRICE_UNAVAILABLE zeroes every monetary field; EXCHANGE_RATE_UNAVAILABLE zeroes only the bridged currency.
 */
public enum ValuationError {
    PRICE_UNAVAILABLE,
    EXCHANGE_RATE_UNAVAILABLE
}
