package com.portsyncro.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Opaque instrument key as supplied by the caller. Equities may carry a market suffix
 * ({@code BBCA.JK}, {@code BBCA:IDX}) marking the domestic market; a bare equity ticker is a foreign listing.
 * Crypto ids are bare symbols; gold ids are {@code GOLD} (spot) or {@code GOLD:<BRAND>} (physical bar).
 * Deduplication and lookups are case-insensitive via {@link #key()}; {@link #value()} keeps the caller's spelling.
 */
public record InstrumentId(String value) {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9.:=-]{1,20}");
    private static final String GOLD = "GOLD";

    public InstrumentId {
        if (value == null || !VALID.matcher(value.strip()).matches()) {
            throw new IllegalArgumentException("Invalid instrument id: " + value);
        }
        value = value.strip();
    }

    public static InstrumentId of(String value) {
        return new InstrumentId(value);
    }

    public static boolean isValid(String value) {
        return value != null && VALID.matcher(value.strip()).matches();
    }

    /** Upper-cased key used for deduplication and price map lookups. */
    public String key() {
        return value.toUpperCase(Locale.ROOT);
    }

    /** Ticker without market suffix. */
    public String symbol() {
        String k = key();
        int sep = separatorIndex(k);
        return sep < 0 ? k : k.substring(0, sep);
    }

    public Optional<String> suffix() {
        String k = key();
        int sep = separatorIndex(k);
        return sep < 0 || sep == k.length() - 1 ? Optional.empty() : Optional.of(k.substring(sep + 1));
    }

    public boolean isDomesticEquity() {
        return suffix().map(s -> s.equals("JK") || s.equals("IDX")).orElse(false);
    }

    public Market equityMarket() {
        return isDomesticEquity() ? Market.DOMESTIC : Market.FOREIGN;
    }

    public InstrumentKind equityKind() {
        return isDomesticEquity() ? InstrumentKind.DOMESTIC_EQUITY : InstrumentKind.FOREIGN_EQUITY;
    }

    /** Symbol as understood by the Yahoo endpoints: {@code BBCA.JK} for IDX listings, plain ticker otherwise. */
    public String yahooSymbol() {
        return isDomesticEquity() ? symbol() + ".JK" : key();
    }

    /** Symbol as used in Google Finance quote URLs, e.g. {@code BBCA:IDX}. */
    public String googleSymbol() {
        return symbol() + ":IDX";
    }

    public boolean isGold() {
        return symbol().equals(GOLD);
    }

    /** Physical bar brand for {@code GOLD:<BRAND>}; empty for spot gold. */
    public Optional<String> goldBrand() {
        return isGold() ? suffix() : Optional.empty();
    }

    private static int separatorIndex(String k) {
        int dot = k.indexOf('.');
        int colon = k.indexOf(':');
        if (dot < 0) {
            return colon;
        }
        if (colon < 0) {
            return dot;
        }
        return Math.min(dot, colon);
    }

    @Override
    public String toString() {
        return value;
    }
}
