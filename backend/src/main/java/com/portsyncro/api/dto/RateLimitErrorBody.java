package com.portsyncro.api.dto;

/**
 * 429 body for refused price requests. retryAfter is in seconds.
 */
public record RateLimitErrorBody(String message, long retryAfter, String error, String identifier) {

    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";

    public static RateLimitErrorBody of(long retryAfterSeconds, String identifier) {
        return new RateLimitErrorBody("Too many requests. Please try again later.", retryAfterSeconds,
                RATE_LIMIT_EXCEEDED, identifier);
    }
}
