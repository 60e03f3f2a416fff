package com.portsyncro.common;

/**
 * Bounded retry for single upstream calls. A 429 is retried after {@code rateLimitedBackoffMs * attempt};
 * any other non-timeout failure after a fixed {@code failureDelayMs}. Timeouts are never retried.
 */
public final class FetchRetryPolicy {

    private final int maxRetries;
    private final long rateLimitedBackoffMs;
    private final long failureDelayMs;

    public FetchRetryPolicy(int maxRetries, long rateLimitedBackoffMs, long failureDelayMs) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.rateLimitedBackoffMs = Math.max(0, rateLimitedBackoffMs);
        this.failureDelayMs = Math.max(0, failureDelayMs);
    }

    /**
     * Delay before retrying after a 429 on the given 1-based attempt.
     */
    public long delayAfterRateLimitMs(int attempt) {
        return rateLimitedBackoffMs * Math.max(1, attempt);
    }

    public long delayAfterFailureMs() {
        return failureDelayMs;
    }

    /** Initial call plus retries. */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Default: one retry, 1s backoff per attempt on 429, 500ms after other failures.
     */
    public static FetchRetryPolicy defaultPolicy() {
        return new FetchRetryPolicy(1, 1000L, 500L);
    }
}
