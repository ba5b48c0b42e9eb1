package com.homepage.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExecutorConfig")
class ExecutorConfigTest {

    private final ExecutorConfig config = new ExecutorConfig();

    @Test
    @DisplayName("should run more stream readers than the pool holds without rejecting")
    void shouldNeverRejectStreamReaders() throws InterruptedException {
        Executor executor = config.processStreamExecutor();
        int tasks = 20;
        CountDownLatch done = new CountDownLatch(tasks);

        for (int i = 0; i < tasks; i++) {
            executor.execute(done::countDown);
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    @DisplayName("should provide a system clock")
    void shouldProvideClock() {
        Clock clock = config.clock();

        assertThat(clock.getZone()).isNotNull();
    }
}
