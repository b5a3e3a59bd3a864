package com.omnioracle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: persistence-executor for snapshot/audit writes, sync-executor for peer callbacks.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String PERSISTENCE_EXECUTOR = "persistence-executor";
    public static final String SYNC_EXECUTOR = "sync-executor";

    /** Single thread so snapshot writes land in event order. */
    @Bean(name = PERSISTENCE_EXECUTOR)
    public Executor persistenceExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("persist-");
        e.initialize();
        return e;
    }

    @Bean(name = SYNC_EXECUTOR)
    public Executor syncExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("sync-");
        e.initialize();
        return e;
    }
}
