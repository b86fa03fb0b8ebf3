package com.purchasingpower.taskhub.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for storage work.
 *
 * <p>{@code storageExecutor} runs the blocking backend calls; {@code storageScheduler}
 * fires operation deadlines and health checks. Both are owned by the context and shut
 * down with it, after the router that uses them.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "storageExecutor")
    public ThreadPoolTaskExecutor storageExecutor(StorageProperties properties) {
        ExecutorProperties pool = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(pool.getCorePoolSize(), pool.getMaxPoolSize()));
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("storage-");

        // In-flight backend calls get a chance to finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Storage executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                pool.getQueueCapacity());

        return executor;
    }

    @Bean(name = "storageScheduler")
    public ThreadPoolTaskScheduler storageScheduler(StorageProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getExecutor().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("storage-timer-");

        // Cancelled deadlines leave the queue right away
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();

        log.info("✅ Storage scheduler configured: pool={}", properties.getExecutor().getSchedulerPoolSize());
        return scheduler;
    }
}
