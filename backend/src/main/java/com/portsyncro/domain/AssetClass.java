package com.portsyncro.domain;

/**
 * Asset class of a holding. CASH is valued at face value and never counts towards invested capital or profit.
 */
public enum AssetClass {
    STOCK,
    CRYPTO,
    GOLD,
    CASH
}
