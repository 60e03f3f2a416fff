package com.portsyncro.domain;

/**
 * Selects the fetch strategy chain for an instrument.
 */
public enum InstrumentKind {
    DOMESTIC_EQUITY,
    FOREIGN_EQUITY,
    CRYPTO,
    GOLD
}
