package com.resourcelocator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for Storage Adapter calls.
 *
 * <p>Storage reads and audit appends run here so the calling thread can stop waiting
 * at its deadline. The pool is bounded; when it is saturated new calls are rejected
 * and surface as storage unavailability instead of queueing past their deadline.
 */
@Configuration
@Slf4j
public class ExecutorConfiguration {

    public static final String STORAGE_EXECUTOR = "storageExecutor";

    @Bean(name = STORAGE_EXECUTOR)
    public ThreadPoolTaskExecutor storageExecutor() {
        log.info("Configuring bounded storage I/O executor");

        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processors * 2);
        executor.setMaxPoolSize(processors * 8);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("storage-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
