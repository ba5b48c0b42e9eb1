package com.homepage.api.service;

import com.homepage.api.config.ExecutorConfig;
import com.homepage.api.service.ProcessRunner.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProcessRunner")
@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {

    @TempDir
    Path tempDir;

    private ProcessRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ProcessRunner(new ExecutorConfig().processStreamExecutor());
        ReflectionTestUtils.setField(runner, "defaultTimeoutMs", 10_000L);
    }

    @Test
    @DisplayName("should capture exit code and both output streams")
    void shouldCaptureOutput() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err >&2; exit 3"), Map.of());

        assertThat(result.getExitCode()).isEqualTo(3);
        assertThat(result.getStdout()).isEqualTo("out");
        assertThat(result.getStderr()).isEqualTo("err");
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isTimedOut()).isFalse();
    }

    @Test
    @DisplayName("should pass extra environment to the child only")
    void shouldPassEnvironment() {
        CommandResult result = runner.run(List.of("sh", "-c", "printf %s \"$PGPASSWORD\""),
                Map.of("PGPASSWORD", "s3cr3t"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStdout()).isEqualTo("s3cr3t");
        assertThat(System.getenv("PGPASSWORD")).isNotEqualTo("s3cr3t");
    }

    @Test
    @DisplayName("should not deadlock on output larger than the pipe buffer")
    void shouldDrainLargeOutput() {
        CommandResult result = runner.run(
                List.of("sh", "-c", "i=0; while [ $i -lt 20000 ]; do echo 'ERROR: line padding padding padding' >&2; i=$((i+1)); done"),
                Map.of(), Duration.ofSeconds(30));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStderr().split("\n")).hasSize(20000);
    }

    @Test
    @DisplayName("should kill a process that exceeds its timeout")
    void shouldKillOnTimeout() throws IOException, InterruptedException {
        Path pidFile = tempDir.resolve("pid");
        CommandResult result = runner.run(
                List.of("sh", "-c", "echo $$ > " + pidFile + "; exec sleep 30"),
                Map.of(), Duration.ofMillis(500));

        assertThat(result.isTimedOut()).isTrue();
        assertThat(result.getExitCode()).isEqualTo(ProcessRunner.NO_EXIT_CODE);

        long pid = Long.parseLong(Files.readString(pidFile).trim());
        assertThat(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false)).isFalse();
    }

    @Test
    @DisplayName("should report a command that cannot be started")
    void shouldReportStartFailure() {
        CommandResult result = runner.run(List.of(tempDir.resolve("does-not-exist").toString()), Map.of());

        assertThat(result.getExitCode()).isEqualTo(ProcessRunner.NO_EXIT_CODE);
        assertThat(result.isTimedOut()).isFalse();
        assertThat(result.getStderr()).isNotEmpty();
    }
}
