package com.portsyncro.pricing.fetch;

import lombok.Getter;

/**
 * Thrown when an upstream call fails after the bounded retries of {@link SourceFetcher}. Callers must not retry.
 */
@Getter
public class FetchException extends RuntimeException {

    private final Reason reason;
    private final int status;

    public FetchException(Reason reason, String message) {
        this(reason, 0, message, null);
    }

    public FetchException(Reason reason, int status, String message) {
        this(reason, status, message, null);
    }

    public FetchException(Reason reason, int status, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.status = status;
    }

    public enum Reason {
        /** Hard timeout hit; the call was cancelled. */
        TIMEOUT,
        /** Upstream answered 429. */
        RATE_LIMITED,
        /** Any other non-2xx status. */
        HTTP_ERROR,
        /** Connection, decoding or local throttle failure. */
        TRANSPORT
    }
}
