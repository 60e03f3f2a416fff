package com.portsyncro.domain;

/**
 * Listing market of an equity. DOMESTIC = IDX (IDR, 100-share lots), FOREIGN = US listing (USD, single shares).
 */
public enum Market {
    DOMESTIC,
    FOREIGN
}
