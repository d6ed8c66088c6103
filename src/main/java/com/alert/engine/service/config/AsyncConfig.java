package com.alert.engine.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Async configuration for notification delivery.
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * Executor for per-channel notification dispatch.
     */
    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        log.info("Initializing notification executor with platform thread pool");
        return createPlatformThreadPool("notify-", 2, 8, 500);
    }

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                             int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
