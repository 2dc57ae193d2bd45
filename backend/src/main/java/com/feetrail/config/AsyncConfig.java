package com.feetrail.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: routing-sweep-executor for the startup routing sweep, indexer-backfill-executor
 * for operator-triggered backfills. Neither shares a thread with the polling scheduler.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ROUTING_SWEEP_EXECUTOR = "routing-sweep-executor";
    public static final String INDEXER_BACKFILL_EXECUTOR = "indexer-backfill-executor";

    @Bean(name = ROUTING_SWEEP_EXECUTOR)
    public Executor routingSweepExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("routing-sweep-");
        e.initialize();
        return e;
    }

    /** Single thread: manual backfills queue behind each other. */
    @Bean(name = INDEXER_BACKFILL_EXECUTOR)
    public Executor indexerBackfillExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(16);
        e.setThreadNamePrefix("indexer-backfill-");
        e.initialize();
        return e;
    }
}
