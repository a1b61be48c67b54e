package com.deepansh.rag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Dedicated threads for the session engine's background work.
 *
 * sessionTaskExecutor runs durable-store writes so their timeouts can be
 * enforced from the calling thread. Isolated from the web thread pool so a
 * slow database never starves HTTP request handling.
 * - Core=4, Max=16: writes are I/O bound and short
 * - Queue capacity=200 gives backpressure; a rejected best-effort write is logged and skipped
 *
 * sessionCleanupScheduler drives the expiry sweep. One thread is enough since
 * cycles run with a fixed delay and never overlap.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "sessionTaskExecutor")
    public Executor sessionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("session-io-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "sessionCleanupScheduler")
    public ThreadPoolTaskScheduler sessionCleanupScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("session-cleanup-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
