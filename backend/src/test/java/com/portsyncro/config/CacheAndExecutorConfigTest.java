package com.portsyncro.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class,
        TimeConfig.class
}, properties = "portsyncro.pricing.resolver-pool-size=8")
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.PRICE_EXECUTOR)
    Executor priceExecutor;

    @Autowired
    @Qualifier(AsyncConfig.EVENT_EXECUTOR)
    Executor eventExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("exchange rate and snapshot history caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.EXCHANGE_RATE_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.SNAPSHOT_HISTORY_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.EXCHANGE_RATE_CACHE).put("USD_IDR", "16000");
        assertThat(cacheManager.getCache(CaffeineConfig.EXCHANGE_RATE_CACHE).get("USD_IDR").get()).isEqualTo("16000");
    }

    @Test
    @DisplayName("price executor is sized from configuration")
    void executorsCreated() {
        assertThat(priceExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor price = (ThreadPoolTaskExecutor) priceExecutor;
        assertThat(price.getCorePoolSize()).isEqualTo(8);
        assertThat(price.getMaxPoolSize()).isEqualTo(8);
        assertThat(price.getThreadNamePrefix()).isEqualTo("price-");
        if (eventExecutor instanceof ThreadPoolTaskExecutor e) {
            assertThat(e.getCorePoolSize()).isEqualTo(1);
            assertThat(e.getMaxPoolSize()).isEqualTo(2);
        }
    }

    @Test
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("clock runs in the Jakarta zone by default")
    void clockZone() {
        assertThat(clock.getZone()).isEqualTo(ZoneId.of("Asia/Jakarta"));
    }
}
