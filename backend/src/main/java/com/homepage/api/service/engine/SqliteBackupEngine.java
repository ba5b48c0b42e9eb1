package com.homepage.api.service.engine;

import com.homepage.api.exception.BackupOperationException;
import com.homepage.api.model.DatabaseEngine;
import com.homepage.api.model.ResolvedConnection;
import com.homepage.api.model.RestoreExecution;
import com.homepage.api.model.RestoreState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Embedded SQLite database: backup and restore are plain file copies.
 */
@Slf4j
@Component
public class SqliteBackupEngine implements BackupEngine {

    private static final String RESTORING_SUFFIX = ".restoring";

    @Override
    public DatabaseEngine getEngine() {
        return DatabaseEngine.SQLITE;
    }

    @Override
    public void dump(ResolvedConnection connection, Path destination) {
        Path database = Path.of(connection.getCleanUrl());
        if (!Files.isRegularFile(database)) {
            log.error("[Backup] SQLite database file not found: {}", database);
            throw BackupOperationException.dumpFailed("SQLite database file not found: " + database);
        }

        try {
            Files.copy(database, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("[Backup] SQLite backup failed: {}", e.getMessage());
            deleteQuietly(destination);
            throw BackupOperationException.dumpFailed(e.getMessage(), e);
        }

        log.info("[Backup] SQLite backup completed via file copy");
    }

    /**
     * Copy next to the live file first, then move over it, so a failed copy never
     * leaves a truncated database.
     */
    @Override
    public void restore(ResolvedConnection connection, Path source, RestoreExecution execution) {
        Path database = Path.of(connection.getCleanUrl());
        Path staging = database.resolveSibling(database.getFileName() + RESTORING_SUFFIX);

        execution.transitionTo(RestoreState.RESTORING);
        try {
            Files.copy(source, staging, StandardCopyOption.REPLACE_EXISTING);
            Files.move(staging, database, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("[Restore] SQLite restore failed: {}", e.getMessage());
            throw BackupOperationException.restoreFailed("Restore failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(staging);
        }

        log.info("[Restore] SQLite restoration completed");
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }
}
