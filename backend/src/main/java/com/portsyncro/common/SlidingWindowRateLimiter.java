package com.portsyncro.common;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window admission control keyed by caller identity: at most {@code maxRequests} admissions per
 * identity inside the trailing {@code window}. Each identity bucket is updated atomically via
 * {@link ConcurrentHashMap#compute}, so concurrent batches for the same caller serialize on that key only.
 * Empty buckets are dropped by {@link #sweep(Instant)}, which the owner schedules periodically.
 */
public class SlidingWindowRateLimiter {

    public static final String ANONYMOUS = "anonymous";

    private final Duration window;
    private final int maxRequests;
    private final ViolationListener violationListener;
    private final Map<String, Deque<Instant>> admissions = new ConcurrentHashMap<>();

    /**
     * @param window            trailing window, e.g. 60s
     * @param maxRequests       admissions allowed per identity inside the window, e.g. 30
     * @param violationListener notified on every rejection; may be null
     */
    public SlidingWindowRateLimiter(Duration window, int maxRequests, ViolationListener violationListener) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        this.window = window;
        this.maxRequests = maxRequests;
        this.violationListener = violationListener != null ? violationListener : (identity, count, at) -> { };
    }

    /**
     * Admits the call and records {@code now} for the identity, or rejects it when the window is full.
     *
     * @return true if admitted
     */
    public boolean admit(String identity, Instant now) {
        String key = normalize(identity);
        boolean[] admitted = {false};
        int[] inWindow = {0};
        admissions.compute(key, (k, timestamps) -> {
            Deque<Instant> bucket = timestamps != null ? timestamps : new ArrayDeque<>();
            evictExpired(bucket, now);
            inWindow[0] = bucket.size();
            if (bucket.size() < maxRequests) {
                bucket.addLast(now);
                admitted[0] = true;
            }
            return bucket;
        });
        if (!admitted[0]) {
            violationListener.onViolation(key, inWindow[0], now);
        }
        return admitted[0];
    }

    /**
     * Drops identities with no admission left inside the window.
     *
     * @return number of identities removed
     */
    public int sweep(Instant now) {
        int removed = 0;
        Iterator<String> keys = admissions.keySet().iterator();
        while (keys.hasNext()) {
            String key = keys.next();
            boolean[] dropped = {false};
            admissions.computeIfPresent(key, (k, bucket) -> {
                evictExpired(bucket, now);
                if (bucket.isEmpty()) {
                    dropped[0] = true;
                    return null;
                }
                return bucket;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        return removed;
    }

    public int admissionsInWindow(String identity, Instant now) {
        int[] count = {0};
        admissions.computeIfPresent(normalize(identity), (k, bucket) -> {
            evictExpired(bucket, now);
            count[0] = bucket.size();
            return bucket;
        });
        return count[0];
    }

    public int trackedIdentities() {
        return admissions.size();
    }

    public Duration getWindow() {
        return window;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    private void evictExpired(Deque<Instant> bucket, Instant now) {
        Instant windowStart = now.minus(window);
        while (!bucket.isEmpty() && !bucket.peekFirst().isAfter(windowStart)) {
            bucket.pollFirst();
        }
    }

    private static String normalize(String identity) {
        return identity == null || identity.isBlank() ? ANONYMOUS : identity.strip();
    }

    /**
     * Callback for rejected admissions.
     */
    @FunctionalInterface
    public interface ViolationListener {
        void onViolation(String identity, int admissionsInWindow, Instant at);
    }
}
