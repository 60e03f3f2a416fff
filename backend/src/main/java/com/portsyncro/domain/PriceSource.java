package com.portsyncro.domain;

/**
 * Which fetch strategy produced a price. Order within an instrument kind is the resolution priority.
 */
public enum PriceSource {
    GOOGLE_FINANCE,
    YAHOO_QUOTE,
    YAHOO_CHART,
    CRYPTOCOMPARE_FULL,
    CRYPTOCOMPARE_SPOT,
    INDOGOLD,
    PAXG_PROXY,
    MANUAL
}
