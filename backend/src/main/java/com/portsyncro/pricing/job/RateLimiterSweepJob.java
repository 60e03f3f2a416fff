package com.portsyncro.pricing.job;

import com.portsyncro.common.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodically drops caller identities with no admission left in the window, bounding limiter memory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimiterSweepJob {

    private final SlidingWindowRateLimiter rateLimiter;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${portsyncro.rate-limit.sweep-interval-ms:60000}",
            initialDelayString = "${portsyncro.rate-limit.sweep-interval-ms:60000}")
    public void runScheduled() {
        int removed = rateLimiter.sweep(clock.instant());
        if (removed > 0) {
            log.debug("Rate limiter sweep removed {} idle identities, {} tracked", removed, rateLimiter.trackedIdentities());
        }
    }
}
