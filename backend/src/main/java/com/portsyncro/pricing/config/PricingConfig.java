package com.portsyncro.pricing.config;

import com.portsyncro.common.FetchRetryPolicy;
import com.portsyncro.common.SlidingWindowRateLimiter;
import com.portsyncro.domain.RateLimitViolationEvent;
import com.portsyncro.pricing.fetch.ClientHeaderPool;
import com.portsyncro.pricing.fetch.SourceFetcher;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Pricing module configuration: properties and shared beans (inbound rate limiter, upstream fetcher,
 * CryptoCompare outbound throttle).
 */
@Configuration
@EnableConfigurationProperties({PricingProperties.class, RateLimitProperties.class})
public class PricingConfig {

    /** Rejections are published as {@link RateLimitViolationEvent}. */
    @Bean
    public SlidingWindowRateLimiter priceRateLimiter(RateLimitProperties rateLimitProperties,
                                                     ApplicationEventPublisher eventPublisher) {
        return new SlidingWindowRateLimiter(
                Duration.ofSeconds(rateLimitProperties.getWindowSeconds()),
                rateLimitProperties.getMaxRequests(),
                (identity, count, at) -> eventPublisher.publishEvent(new RateLimitViolationEvent(identity, count, at)));
    }

    @Bean
    public FetchRetryPolicy fetchRetryPolicy(PricingProperties pricingProperties) {
        return new FetchRetryPolicy(pricingProperties.getMaxRetries(),
                pricingProperties.getRateLimitedBackoffMs(), pricingProperties.getFailureDelayMs());
    }

    @Bean
    public SourceFetcher sourceFetcher(WebClient.Builder webClientBuilder, FetchRetryPolicy fetchRetryPolicy) {
        return new SourceFetcher(webClientBuilder, fetchRetryPolicy);
    }

    @Bean
    public ClientHeaderPool clientHeaderPool(PricingProperties pricingProperties) {
        return new ClientHeaderPool(pricingProperties.getUserAgents());
    }

    @Bean
    public RateLimiter cryptocompareThrottle(PricingProperties pricingProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(pricingProperties.getCryptocompareRequestsPerSecond())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ofMillis(pricingProperties.getCryptocomparePermitTimeoutMs()))
                .build();
        return RateLimiter.of("cryptocompare", config);
    }
}
