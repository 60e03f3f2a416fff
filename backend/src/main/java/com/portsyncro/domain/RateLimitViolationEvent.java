package com.portsyncro.domain;

import java.time.Instant;

/**
 * Application event: a caller was refused admission to price resolution.
 */
public record RateLimitViolationEvent(String identity, int admissionsInWindow, Instant occurredAt) {
}
