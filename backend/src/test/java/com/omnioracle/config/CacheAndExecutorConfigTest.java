package com.omnioracle.config;

import com.github.benmanes.caffeine.cache.Cache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(CaffeineConfig.FEED_DECIMALS_CACHE)
    Cache<String, Integer> feedDecimalsCache;

    @Autowired
    @Qualifier(AsyncConfig.PERSISTENCE_EXECUTOR)
    Executor persistenceExecutor;

    @Autowired
    @Qualifier(AsyncConfig.SYNC_EXECUTOR)
    Executor syncExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("pool metadata cache and feed decimals cache are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.POOL_META_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.POOL_META_CACHE).put("0xpool", "0xtoken0");
        assertThat(cacheManager.getCache(CaffeineConfig.POOL_META_CACHE).get("0xpool").get()).isEqualTo("0xtoken0");

        feedDecimalsCache.put("0xfeed", 8);
        assertThat(feedDecimalsCache.getIfPresent("0xfeed")).isEqualTo(8);
    }

    @Test
    @DisplayName("async executors are created with correct pool sizes")
    void executorsCreated() {
        assertThat(persistenceExecutor).isNotNull();
        assertThat(syncExecutor).isNotNull();
        if (persistenceExecutor instanceof ThreadPoolTaskExecutor p) {
            assertThat(p.getCorePoolSize()).isEqualTo(1);
            assertThat(p.getMaxPoolSize()).isEqualTo(1);
        }
        if (syncExecutor instanceof ThreadPoolTaskExecutor s) {
            assertThat(s.getCorePoolSize()).isEqualTo(2);
            assertThat(s.getMaxPoolSize()).isEqualTo(4);
        }
    }

    @Test
    @DisplayName("scheduler pool is created and configured")
    void schedulerPoolCreated() {
        assertThat(schedulerPool).isNotNull();
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("oracle-sched-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }
}
