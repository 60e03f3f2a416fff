package com.portsyncro.domain;

public enum PriceCurrency {
    IDR,
    USD;

    /**
     * Lenient parse of an upstream currency code. Anything other than IDR is treated as USD.
     */
    public static PriceCurrency fromCode(String code) {
        if (code != null && "IDR".equalsIgnoreCase(code.strip())) {
            return IDR;
        }
        return USD;
    }
}
