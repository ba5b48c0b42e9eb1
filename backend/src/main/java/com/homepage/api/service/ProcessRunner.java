package com.homepage.api.service;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Service for executing external tools (pg_dump, psql) as local subprocesses.
 * Output is captured in full by background readers, execution is bounded by a
 * wall-clock timeout, and a timed out process is killed together with its descendants.
 */
@Slf4j
@Service
public class ProcessRunner {

    /** Exit code reported when the process could not be started or the wait was interrupted. */
    public static final int NO_EXIT_CODE = -1;

    private static final long REAP_TIMEOUT_MS = 5000;

    @Value("${backup.timeouts.default-command-ms:60000}")
    private long defaultTimeoutMs;

    private final Executor streamExecutor;

    public ProcessRunner(@Qualifier("processStreamExecutor") Executor streamExecutor) {
        this.streamExecutor = streamExecutor;
    }

    /**
     * Execute a command using the default timeout from configuration
     */
    public CommandResult run(List<String> command, Map<String, String> environment) {
        return run(command, environment, Duration.ofMillis(defaultTimeoutMs));
    }

    /**
     * Execute a command with a custom timeout.
     * Entries of {@code environment} are added to the inherited environment of the child only.
     */
    public CommandResult run(List<String> command, Map<String, String> environment, Duration timeout) {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.error("Failed to start {}: {}", command.get(0), e.getMessage());
            return new CommandResult(NO_EXIT_CODE, "", e.getMessage(), false);
        }

        // stdin is never used; close it so tools waiting for input see EOF
        closeQuietly(process);

        CompletableFuture<String> stdout = capture(process.getInputStream());
        CompletableFuture<String> stderr = capture(process.getErrorStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("{} exceeded {} seconds, killing process {}",
                        command.get(0), timeout.toSeconds(), process.pid());
                kill(process);
                return new CommandResult(NO_EXIT_CODE, collect(stdout), collect(stderr), true);
            }

            return new CommandResult(process.exitValue(), collect(stdout), collect(stderr), false);

        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            return new CommandResult(NO_EXIT_CODE, "", "Interrupted while waiting for " + command.get(0), false);
        }
    }

    private CompletableFuture<String> capture(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                in.transferTo(buffer);
                return buffer.toString(StandardCharsets.UTF_8);
            } catch (IOException e) {
                // stream is closed underneath us when the process is killed
                log.debug("Output capture ended early: {}", e.getMessage());
                return "";
            }
        }, streamExecutor);
    }

    /**
     * Wait for a reader to drain; a descendant that escaped the kill may keep the pipe open.
     */
    private String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(REAP_TIMEOUT_MS, TimeUnit.MILLISECONDS).trim();
        } catch (TimeoutException e) {
            output.cancel(true);
            log.warn("Gave up waiting for subprocess output after {} ms", REAP_TIMEOUT_MS);
            return "";
        } catch (ExecutionException e) {
            log.debug("Output capture failed: {}", e.getMessage());
            return "";
        }
    }

    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(REAP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.error("Process {} did not terminate after being killed", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of process {}: {}", process.pid(), e.getMessage());
        }
    }

    @Data
    public static class CommandResult {
        private final int exitCode;
        private final String stdout;
        private final String stderr;
        private final boolean timedOut;

        public boolean isSuccess() {
            return exitCode == 0 && !timedOut;
        }
    }
}
