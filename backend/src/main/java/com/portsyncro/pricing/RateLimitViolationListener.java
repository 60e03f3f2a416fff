package com.portsyncro.pricing;

import com.portsyncro.config.AsyncConfig;
import com.portsyncro.domain.RateLimitViolationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Records refused price requests for security monitoring.
 */
@Component
@Slf4j
public class RateLimitViolationListener {

    @Async(AsyncConfig.EVENT_EXECUTOR)
    @EventListener
    public void onViolation(RateLimitViolationEvent event) {
        log.warn("Rate limit exceeded for {}: {} requests in window at {}",
                event.identity(), event.admissionsInWindow(), event.occurredAt());
    }
}
