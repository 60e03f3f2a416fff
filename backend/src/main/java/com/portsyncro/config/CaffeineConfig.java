package com.portsyncro.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String EXCHANGE_RATE_CACHE = "exchangeRateCache";
    public static final String SNAPSHOT_HISTORY_CACHE = "snapshotHistoryCache";

    @Bean
    public CacheManager caffeineCacheManager(
            @Value("${portsyncro.pricing.exchange-rate-cache-ttl-minutes:5}") long exchangeRateTtlMinutes) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(EXCHANGE_RATE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(exchangeRateTtlMinutes, TimeUnit.MINUTES)
                .maximumSize(1)
                .build());
        manager.registerCustomCache(SNAPSHOT_HISTORY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.MINUTES)
                .maximumSize(200)
                .build());
        return manager;
    }
}
