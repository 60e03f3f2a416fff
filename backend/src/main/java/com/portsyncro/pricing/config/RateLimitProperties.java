package com.portsyncro.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Inbound rate limit for price resolution, per caller identity. Under portsyncro.rate-limit.
 */
@ConfigurationProperties(prefix = "portsyncro.rate-limit")
@Getter
@Setter
public class RateLimitProperties {

    /** Trailing window in seconds. Also reported to rejected callers as retryAfter. */
    private int windowSeconds = 60;

    /** Admissions per identity inside the window. */
    private int maxRequests = 30;

    /** Interval of the sweep that drops idle identities. */
    private long sweepIntervalMs = 60_000;

    /**
     * Whether a client-supplied user id (X-User-Id header or body userId) keys the caller. Nothing authenticates that
     * id, so a caller can rotate it to dodge the limit; turn this off on a public deployment without an auth gateway
     * in front, and every caller is keyed by address and user agent.
     */
    private boolean trustClientUserId = true;
}
