package com.homepage.api.service.engine;

import com.homepage.api.exception.BackupOperationException;
import com.homepage.api.model.BackupWarning;
import com.homepage.api.model.DatabaseEngine;
import com.homepage.api.model.ResolvedConnection;
import com.homepage.api.model.RestoreExecution;
import com.homepage.api.model.RestoreState;
import com.homepage.api.model.SanitizationRule;
import com.homepage.api.model.SanitizeResult;
import com.homepage.api.service.ProcessRunner;
import com.homepage.api.service.ProcessRunner.CommandResult;
import com.homepage.api.service.SqlDumpSanitizer;
import com.homepage.api.util.OutputSummary;
import com.homepage.api.util.RestoreOutputClassifier;
import com.homepage.api.util.RestoreOutputClassifier.Classification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * PostgreSQL dumps with pg_dump and restores with psql.
 * Dumps are taken with flags chosen for portability across server versions, and
 * restores run drain, sanitize and replay in sequence. The sanitized copy of the
 * dump is removed on every exit path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostgresBackupEngine implements BackupEngine {

    static final String SANITIZED_SUFFIX = ".sanitized";

    private static final int LOG_PREVIEW_LINES = 3;
    private static final int STDOUT_PREVIEW_CHARS = 500;

    private final ProcessRunner processRunner;
    private final SqlDumpSanitizer sanitizer;

    @Value("${backup.tools.pg-dump:pg_dump}")
    private String pgDumpPath;

    @Value("${backup.tools.psql:psql}")
    private String psqlPath;

    @Value("${backup.timeouts.dump-seconds:3600}")
    private long dumpTimeoutSeconds;

    @Value("${backup.timeouts.restore-seconds:600}")
    private long restoreTimeoutSeconds;

    @Value("${backup.timeouts.drain-seconds:30}")
    private long drainTimeoutSeconds;

    @Value("${backup.sanitize.extra-prefixes:}")
    private String extraSanitizePrefixes;

    @Override
    public DatabaseEngine getEngine() {
        return DatabaseEngine.POSTGRESQL;
    }

    /**
     * pg_dump flags:
     * --no-owner/--no-acl drop ownership and privileges,
     * --clean --if-exists emit DROP ... IF EXISTS before each CREATE,
     * --no-comments omits version-specific COMMENT statements.
     */
    @Override
    public void dump(ResolvedConnection connection, Path destination) {
        List<String> command = List.of(
                pgDumpPath,
                "--dbname=" + connection.getCleanUrl(),
                "--file=" + destination,
                "--no-owner",
                "--no-acl",
                "--clean",
                "--if-exists",
                "--no-comments"
        );

        CommandResult result = processRunner.run(command, connection.childEnvironment(),
                Duration.ofSeconds(dumpTimeoutSeconds));

        if (!result.isSuccess()) {
            deletePartialDump(destination);
            String detail = result.isTimedOut()
                    ? "pg_dump timed out after " + dumpTimeoutSeconds + " seconds"
                    : result.getStderr();
            log.error("[Backup] pg_dump failed (code {}): {}", result.getExitCode(), OutputSummary.summarize(detail));
            throw BackupOperationException.dumpFailed(detail);
        }

        log.info("[Backup] PostgreSQL backup completed successfully");
    }

    @Override
    public void restore(ResolvedConnection connection, Path source, RestoreExecution execution) {
        Path sanitizedPath = source.resolveSibling(source.getFileName() + SANITIZED_SUFFIX);

        try {
            execution.transitionTo(RestoreState.DRAINING);
            terminateConnections(connection, execution);

            execution.transitionTo(RestoreState.SANITIZING);
            SanitizeResult sanitized = sanitizer.sanitize(source, sanitizedPath, sanitizationRules());
            execution.recordSanitize(sanitized);

            execution.transitionTo(RestoreState.RESTORING);
            executePsqlRestore(connection, sanitizedPath, execution);

            log.info("[Restore] PostgreSQL restore completed successfully for {}", execution.getFilename());
        } finally {
            removeSanitizedFile(sanitizedPath, execution);
        }
    }

    List<SanitizationRule> sanitizationRules() {
        if (extraSanitizePrefixes == null || extraSanitizePrefixes.isBlank()) {
            return SanitizationRule.defaults();
        }
        return SanitizationRule.defaults(Arrays.asList(extraSanitizePrefixes.split(",")));
    }

    /**
     * Terminate all other sessions on the target database so DROP/CREATE in the dump
     * are not blocked. Best effort: failure is recorded as a warning only.
     */
    private void terminateConnections(ResolvedConnection connection, RestoreExecution execution) {
        String database = connection.getParams().getDatabase();
        log.info("[Restore] Terminating existing connections to {}...", database);

        String killSql = "SELECT pg_terminate_backend(pid) FROM pg_stat_activity WHERE datname = '"
                + database.replace("'", "''") + "' AND pid <> pg_backend_pid();";

        CommandResult result = processRunner.run(
                List.of(psqlPath, "--dbname=" + connection.getCleanUrl(), "-c", killSql),
                connection.childEnvironment(),
                Duration.ofSeconds(drainTimeoutSeconds));

        if (result.isSuccess()) {
            log.info("[Restore] Connections terminated successfully");
            return;
        }

        String detail = result.isTimedOut()
                ? "connection termination timed out after " + drainTimeoutSeconds + " seconds"
                : OutputSummary.summarize(result.getStderr());
        log.warn("[Restore] Connection termination warning: {}", detail);
        execution.addWarning(BackupWarning.connectionDrain(detail));
    }

    /**
     * Replay the sanitized dump without ON_ERROR_STOP: cross-version restores emit
     * non-fatal errors that must not abort the whole script. Only explicit fatal
     * markers combined with a non-zero exit code fail the restore.
     */
    private void executePsqlRestore(ResolvedConnection connection, Path sanitizedPath, RestoreExecution execution) {
        log.info("[Restore] Executing psql restore for {}...", execution.getFilename());

        Duration timeout = Duration.ofSeconds(restoreTimeoutSeconds);
        CommandResult result = processRunner.run(
                List.of(psqlPath, "--dbname=" + connection.getCleanUrl(), "--file=" + sanitizedPath),
                connection.childEnvironment(),
                timeout);

        if (result.isTimedOut()) {
            log.error("[Restore] psql restore timed out after {} seconds", timeout.toSeconds());
            throw BackupOperationException.restoreTimeout(timeout);
        }
        if (result.getExitCode() == ProcessRunner.NO_EXIT_CODE) {
            log.error("[Restore] psql could not be run: {}", OutputSummary.summarize(result.getStderr()));
            throw BackupOperationException.restoreFailed("Could not run restore tool: " + result.getStderr(), null);
        }

        if (!result.getStdout().isEmpty() && log.isDebugEnabled()) {
            String stdout = result.getStdout();
            log.debug("[Restore] psql stdout: {}", stdout.substring(0, Math.min(STDOUT_PREVIEW_CHARS, stdout.length())));
        }

        Classification output = RestoreOutputClassifier.classify(result.getStderr());
        execution.recordToolOutput(output.getErrorLines().size(), output.getWarningLines().size());

        if (output.hasErrors()) {
            log.error("[Restore] psql errors ({}): {}", output.getErrorLines().size(),
                    Classification.head(output.getErrorLines(), LOG_PREVIEW_LINES));
        }
        if (!output.getWarningLines().isEmpty()) {
            log.warn("[Restore] psql warnings ({}): {}", output.getWarningLines().size(),
                    Classification.head(output.getWarningLines(), LOG_PREVIEW_LINES));
        }

        if (result.getExitCode() != 0) {
            if (output.hasErrors()) {
                String firstError = output.firstError().orElseThrow();
                log.error("[Restore] Critical error during restore: {}", firstError);
                throw BackupOperationException.restoreFailed(firstError);
            }
            log.warn("[Restore] psql returned {} but no critical errors found", result.getExitCode());
        }
    }

    private void removeSanitizedFile(Path sanitizedPath, RestoreExecution execution) {
        try {
            Files.deleteIfExists(sanitizedPath);
        } catch (IOException e) {
            log.warn("[Restore] Failed to delete temporary file {}: {}", sanitizedPath, e.getMessage());
            execution.addWarning(BackupWarning.cleanup("Failed to delete " + sanitizedPath.getFileName()));
        }
    }

    private void deletePartialDump(Path destination) {
        try {
            Files.deleteIfExists(destination);
        } catch (IOException e) {
            log.warn("[Backup] Failed to delete partial dump {}: {}", destination, e.getMessage());
        }
    }
}
