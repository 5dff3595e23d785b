package com.sandy.netwatch.monitor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for per-key ticks, the scan and sweep loops, and backing store I/O.
 */
@Configuration
@Slf4j
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Picked up by {@code @Scheduled} as well, being the only TaskScheduler in the context. */
    @Bean
    public ThreadPoolTaskScheduler monitorTaskScheduler(MonitorProperties properties) {
        MonitorProperties.Scheduler cfg = properties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(cfg.getPoolSize());
        scheduler.setThreadNamePrefix("rate-monitor-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(cfg.getShutdownGraceSeconds());
        scheduler.setErrorHandler(t -> log.error("Unhandled error in monitor task: {}", t.getMessage(), t));
        log.info("Monitor task scheduler configured: poolSize={} shutdownGraceSeconds={}", cfg.getPoolSize(), cfg.getShutdownGraceSeconds());
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor storageExecutor(MonitorProperties properties) {
        MonitorProperties.Storage cfg = properties.getStorage();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getExecutorThreads());
        executor.setMaxPoolSize(cfg.getExecutorThreads());
        executor.setQueueCapacity(cfg.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("series-store-");
        // a full queue fails the operation, which then goes through the normal retry path
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getScheduler().getShutdownGraceSeconds());
        return executor;
    }
}
