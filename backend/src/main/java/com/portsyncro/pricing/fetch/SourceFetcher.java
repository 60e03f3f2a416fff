package com.portsyncro.pricing.fetch;

import com.portsyncro.common.FetchRetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Single upstream GET with a hard timeout and bounded retries. Shared by every price and rate integration.
 * Blocks the calling thread; run it on a worker pool, never on an event-loop thread.
 */
@Slf4j
public class SourceFetcher {

    private final WebClient webClient;
    private final FetchRetryPolicy retryPolicy;

    public SourceFetcher(WebClient.Builder webClientBuilder, FetchRetryPolicy retryPolicy) {
        this.webClient = webClientBuilder.build();
        this.retryPolicy = retryPolicy != null ? retryPolicy : FetchRetryPolicy.defaultPolicy();
    }

    public RawResponse fetch(String url, Map<String, String> headers, Duration timeout) {
        return fetch(url, headers, timeout, null);
    }

    /**
     * @param throttle optional outbound limiter for the upstream; a refused permit counts as a failed attempt
     * @throws FetchException when every attempt failed or the call timed out
     */
    public RawResponse fetch(String url, Map<String, String> headers, Duration timeout, RateLimiter throttle) {
        FetchException last = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (throttle != null && !throttle.acquirePermission()) {
                    throw new FetchException(FetchException.Reason.TRANSPORT, "Outbound throttle refused " + throttle.getName());
                }
                return once(url, headers, timeout);
            } catch (FetchException e) {
                last = e;
                if (e.getReason() == FetchException.Reason.TIMEOUT || attempt == maxAttempts) {
                    break;
                }
                long delay = e.getReason() == FetchException.Reason.RATE_LIMITED
                        ? retryPolicy.delayAfterRateLimitMs(attempt)
                        : retryPolicy.delayAfterFailureMs();
                log.debug("Retrying {} after {} ({}ms)", url, e.getReason(), delay);
                sleep(delay);
            }
        }
        throw new FetchException(last.getReason(), last.getStatus(),
                "Fetch failed for " + url + ": " + last.getMessage(), last);
    }

    private RawResponse once(String url, Map<String, String> headers, Duration timeout) {
        RawResponse response;
        try {
            response = webClient.get()
                    .uri(URI.create(url))
                    .headers(h -> {
                        if (headers != null) {
                            headers.forEach(h::set);
                        }
                    })
                    .exchangeToMono(r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RawResponse(r.statusCode().value(), body)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new FetchException(FetchException.Reason.TIMEOUT, 0, "Timed out after " + timeout.toMillis() + "ms", cause);
            }
            throw new FetchException(FetchException.Reason.TRANSPORT, 0, String.valueOf(cause.getMessage()), cause);
        }
        if (response == null) {
            throw new FetchException(FetchException.Reason.TRANSPORT, "Empty response");
        }
        if (response.status() == 429) {
            throw new FetchException(FetchException.Reason.RATE_LIMITED, 429, "HTTP 429");
        }
        if (response.status() < 200 || response.status() >= 300) {
            throw new FetchException(FetchException.Reason.HTTP_ERROR, response.status(), "HTTP " + response.status());
        }
        return response;
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Reason.TRANSPORT, 0, "Interrupted during retry backoff", e);
        }
    }
}
