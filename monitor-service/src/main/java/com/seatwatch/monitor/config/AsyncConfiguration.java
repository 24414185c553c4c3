package com.seatwatch.monitor.config;

import com.seatwatch.monitor.constants.MonitorConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pools for the background context: one for per-route checks, one for notification delivery.
 */
@Configuration
@Slf4j
public class AsyncConfiguration {

    public static final String ROUTE_CHECK_EXECUTOR = "routeCheckExecutor";
    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    @Bean(name = ROUTE_CHECK_EXECUTOR)
    public ThreadPoolTaskExecutor routeCheckExecutor(
            @Value("${monitor.check.executor-threads:" + MonitorConstants.DEFAULT_CHECK_EXECUTOR_THREADS + "}") int threads,
            @Value("${monitor.check.queue-capacity:1000}") int queueCapacity) {
        return buildExecutor("route-check-", threads, queueCapacity);
    }

    @Bean(name = NOTIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor notificationExecutor(
            @Value("${monitor.notification.executor-threads:" + MonitorConstants.DEFAULT_NOTIFICATION_EXECUTOR_THREADS + "}") int threads,
            @Value("${monitor.notification.queue-capacity:1000}") int queueCapacity) {
        return buildExecutor("notify-", threads, queueCapacity);
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        log.info("Executor configured: prefix={}, threads={}, queueCapacity={}", prefix, threads, queueCapacity);
        return executor;
    }
}
