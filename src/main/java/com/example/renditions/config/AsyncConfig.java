package com.example.renditions.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for transcodes plus scheduling for the cache janitor.
 * The pool has exactly K threads and an unbounded FIFO queue, so submitting never blocks
 * and at most K encodes run at once.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String TRANSCODE_EXECUTOR = "transcodeTaskExecutor";

    @Bean(name = TRANSCODE_EXECUTOR)
    public ThreadPoolTaskExecutor transcodeTaskExecutor(
            @Value("${transcode.max-concurrent-transcodes:2}") int maxConcurrentTranscodes) {
        if (maxConcurrentTranscodes < 1) {
            throw new IllegalArgumentException(
                    "transcode.max-concurrent-transcodes must be at least 1 but was " + maxConcurrentTranscodes);
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentTranscodes);
        executor.setMaxPoolSize(maxConcurrentTranscodes);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("transcode-worker-");
        executor.setTaskDecorator(uncaughtExceptionLogger());
        // Interrupt running workers on shutdown so they kill their encoder processes
        executor.setWaitForTasksToCompleteOnShutdown(false);
        log.info("Initialized transcode worker pool with {} slots", maxConcurrentTranscodes);
        return executor;
    }

    static TaskDecorator uncaughtExceptionLogger() {
        return task -> () -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("Unhandled exception escaped transcode task on thread '{}':",
                        Thread.currentThread().getName(), ex);
            }
        };
    }
}
