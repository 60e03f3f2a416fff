package com.portsyncro.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: price-executor runs instrument resolutions (blocking upstream I/O),
 * event-executor runs async event listeners.
 * <p>
 * The price pool holds at least one full batch (three categories at the per-category cap), so every instrument of
 * a batch resolves at once and batch latency stays one fallback chain long. Idle threads time out.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String PRICE_EXECUTOR = "price-executor";
    public static final String EVENT_EXECUTOR = "event-executor";

    @Bean(name = PRICE_EXECUTOR)
    public Executor priceExecutor(@Value("${portsyncro.pricing.resolver-pool-size:150}") int poolSize) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(poolSize);
        e.setMaxPoolSize(poolSize);
        e.setAllowCoreThreadTimeOut(true);
        e.setKeepAliveSeconds(60);
        e.setThreadNamePrefix("price-");
        e.initialize();
        return e;
    }

    @Bean(name = EVENT_EXECUTOR)
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("event-");
        e.initialize();
        return e;
    }
}
