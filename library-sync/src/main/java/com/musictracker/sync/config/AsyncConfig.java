package com.musictracker.sync.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for sync jobs. One job per kind runs at a time, so two threads are enough;
 * the small queue only absorbs a trigger that lands while a finished job's thread is
 * still being released.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor(
            @Value("${library-sync.async.pool-size:2}") int poolSize,
            @Value("${library-sync.async.queue-capacity:2}") int queueCapacity,
            @Value("${library-sync.async.thread-name-prefix:sync-}") String threadNamePrefix) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // AbortPolicy: a rejected trigger fails loudly instead of running on the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();

        log.info("Initialized syncTaskExecutor - pool={}, queue={}, prefix='{}'",
                poolSize, queueCapacity, threadNamePrefix);
        return executor;
    }

    /**
     * Carries the caller's MDC into the job thread.
     */
    public static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
