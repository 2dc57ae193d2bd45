package com.feetrail.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Dedicated single-thread scheduler for the fee indexer poll loop.
 */
@Configuration
public class SchedulerConfig {

    public static final String FEE_INDEXER_SCHEDULER = "feeIndexerScheduler";

    @Bean(name = FEE_INDEXER_SCHEDULER)
    public ThreadPoolTaskScheduler feeIndexerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("fee-indexer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
