package com.portsyncro.pricing;

/**
 * Price request rejected before any upstream call: bad symbol or too many instruments in one category.
 */
public class InvalidPriceRequestException extends RuntimeException {

    public InvalidPriceRequestException(String message) {
        super(message);
    }
}
