package com.homepage.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Shared infrastructure beans for the backup engine.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    /**
     * Threads that drain child process stdout/stderr.
     * Two readers per running command; with no queue, a burst beyond the pool
     * runs on the caller rather than leaving a pipe undrained.
     */
    @Bean(name = "processStreamExecutor")
    public Executor processStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);

        // Hand off directly; never park a stream reader behind other work
        executor.setQueueCapacity(0);

        executor.setThreadNamePrefix("process-stream-");
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("Process stream executor initialized: corePoolSize={}, maxPoolSize={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize());

        return executor;
    }

    /**
     * Wall clock for backup names and retention buckets; the zone decides where days begin.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
