package com.homepage.api.service;

import com.homepage.api.exception.BackupOperationException;
import com.homepage.api.model.BackupRecord;
import com.homepage.api.model.DatabaseEngine;
import com.homepage.api.model.ResolvedConnection;
import com.homepage.api.model.RestoreExecution;
import com.homepage.api.model.RestoreState;
import com.homepage.api.model.RetentionPolicy;
import com.homepage.api.model.RetentionResult;
import com.homepage.api.service.engine.BackupEngine;
import com.homepage.api.util.OutputSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Service for creating, listing, restoring and pruning database backups.
 * Backups are single-file dumps of the one configured database, stored flat in the
 * backup directory. Backup, restore, import and retention runs are serialized by a
 * single lock; a second operation arriving while one runs is rejected.
 */
@Slf4j
@Service
public class BackupService {

    static final String INCOMING_DIRECTORY = ".incoming";
    private static final String UPLOAD_PREFIX = "upload_";

    private final BackupCatalog catalog;
    private final ConnectionResolver connectionResolver;
    private final RetentionPlanner retentionPlanner;
    private final Clock clock;
    private final Map<DatabaseEngine, BackupEngine> engines = new EnumMap<>(DatabaseEngine.class);
    private final ReentrantLock operationLock = new ReentrantLock();

    @Value("${backup.database-url:sqlite:///./data/homepage.db}")
    private String databaseUrl;

    @Value("${backup.schedule.enabled:false}")
    private boolean scheduleEnabled;

    @Value("${backup.retention.daily:7}")
    private int retentionDaily;

    @Value("${backup.retention.weekly:4}")
    private int retentionWeekly;

    @Value("${backup.retention.monthly:12}")
    private int retentionMonthly;

    public BackupService(List<BackupEngine> backupEngines,
                         BackupCatalog catalog,
                         ConnectionResolver connectionResolver,
                         RetentionPlanner retentionPlanner,
                         Clock clock) {
        for (BackupEngine engine : backupEngines) {
            BackupEngine previous = engines.put(engine.getEngine(), engine);
            if (previous != null) {
                throw new IllegalStateException("Duplicate backup engine for " + engine.getEngine());
            }
        }
        this.catalog = catalog;
        this.connectionResolver = connectionResolver;
        this.retentionPlanner = retentionPlanner;
        this.clock = clock;
    }

    /**
     * Dump the database into a new backup file, then apply the retention policy.
     *
     * @return The new backup
     * @throws BackupOperationException with kind DUMP_FAILED if the dump tool fails
     */
    public BackupRecord createBackup() {
        return runExclusive(() -> {
            ResolvedConnection connection = resolveConnection();
            ensureRootExists();

            Path target = catalog.nextBackupPath(LocalDateTime.now(clock));
            String filename = target.getFileName().toString();
            log.info("[Backup] Starting {} backup to {}...", connection.getEngine(), filename);

            engineFor(connection).dump(connection, target);
            BackupRecord record = readRecord(target);
            log.info("[Backup] Created {} ({} bytes)", filename, record.getSizeBytes());

            runRetentionQuietly();
            return record;
        });
    }

    public List<BackupRecord> listBackups() {
        return catalog.list();
    }

    /**
     * Restore the database from a backup in the catalog.
     *
     * @throws BackupOperationException BACKUP_NOT_FOUND before the database is touched,
     *         RESTORE_TIMEOUT, RESTORE_FAILED or SANITIZE_IO_FAILURE afterwards
     */
    public RestoreExecution restoreBackup(String filename) {
        return runExclusive(() -> {
            RestoreExecution execution = new RestoreExecution(filename, clock);
            execution.transitionTo(RestoreState.VERIFYING);

            Path source;
            try {
                source = catalog.require(filename);
            } catch (RuntimeException e) {
                log.error("[Restore] Cannot restore {}: {}", filename, e.getMessage());
                execution.fail(e.getMessage());
                throw e;
            }

            return performRestore(source, execution);
        });
    }

    /**
     * Restore from an uploaded dump. The upload is staged outside the catalog listing
     * and deleted afterwards, whatever the outcome.
     */
    public RestoreExecution importBackup(InputStream content, String originalFilename) {
        return runExclusive(() -> {
            String stagedName = UPLOAD_PREFIX + safeUploadName(originalFilename);
            Path staged = stageUpload(content, stagedName);

            try {
                RestoreExecution execution = new RestoreExecution(stagedName, clock);
                execution.transitionTo(RestoreState.VERIFYING);
                return performRestore(staged, execution);
            } finally {
                try {
                    Files.deleteIfExists(staged);
                } catch (IOException e) {
                    log.warn("[Import] Failed to delete staged upload {}: {}", staged, e.getMessage());
                }
            }
        });
    }

    /**
     * @throws BackupOperationException with kind BACKUP_NOT_FOUND if absent
     */
    public void deleteBackup(String filename) {
        catalog.delete(filename);
    }

    public Path resolveForDownload(String filename) {
        return catalog.require(filename);
    }

    public RetentionResult cleanupBackups() {
        return runExclusive(() -> retentionPlanner.cleanup(retentionPolicy()));
    }

    public RetentionPolicy retentionPolicy() {
        return new RetentionPolicy(retentionDaily, retentionWeekly, retentionMonthly);
    }

    // ============ Scheduled Jobs ============

    /**
     * Automatic backup on a fixed interval
     */
    @Scheduled(fixedDelayString = "${backup.schedule.interval-ms:86400000}",
            initialDelayString = "${backup.schedule.initial-delay-ms:300000}")
    public void scheduledBackup() {
        if (!scheduleEnabled) {
            return;
        }
        log.info("Starting scheduled backup...");
        try {
            BackupRecord record = createBackup();
            log.info("Scheduled backup completed: {}", record.getFilename());
        } catch (IllegalStateException e) {
            log.warn("Skipping scheduled backup: {}", e.getMessage());
        } catch (BackupOperationException e) {
            log.error("Scheduled backup failed ({}): {}", e.getKind(), OutputSummary.summarize(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Scheduled backup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Retention pass independent of backup creation
     */
    @Scheduled(cron = "${backup.retention.cron:0 0 5 * * *}")
    public void scheduledCleanup() {
        if (!scheduleEnabled) {
            return;
        }
        log.info("Starting scheduled retention cleanup...");
        try {
            cleanupBackups();
        } catch (IllegalStateException e) {
            log.warn("Skipping scheduled cleanup: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled cleanup failed: {}", e.getMessage(), e);
        }
    }

    // ============ Internals ============

    private RestoreExecution performRestore(Path source, RestoreExecution execution) {
        ResolvedConnection connection = resolveConnection();
        log.info("[Restore] Starting restoration from {}...", execution.getFilename());

        try {
            engineFor(connection).restore(connection, source, execution);
        } catch (RuntimeException e) {
            RestoreState failedIn = execution.getState();
            execution.fail(e.getMessage());
            log.error("[Restore] Restore of {} failed during {}: {}",
                    execution.getFilename(), failedIn, OutputSummary.summarize(e.getMessage()));
            throw e;
        }

        execution.complete();
        log.info("[Restore] Restore of {} completed with {} warning(s)",
                execution.getFilename(), execution.getWarnings().size());
        return execution;
    }

    private void runRetentionQuietly() {
        try {
            retentionPlanner.cleanup(retentionPolicy());
        } catch (RuntimeException e) {
            log.error("[Cleanup] Retention cleanup error: {}", e.getMessage(), e);
        }
    }

    private <T> T runExclusive(Supplier<T> operation) {
        if (!operationLock.tryLock()) {
            throw new IllegalStateException(
                    "A backup or restore operation is already in progress. Please wait for it to complete.");
        }
        try {
            return operation.get();
        } finally {
            operationLock.unlock();
        }
    }

    private ResolvedConnection resolveConnection() {
        return connectionResolver.resolve(databaseUrl);
    }

    private BackupEngine engineFor(ResolvedConnection connection) {
        BackupEngine engine = engines.get(connection.getEngine());
        if (engine == null) {
            throw new IllegalStateException("No backup engine available for " + connection.getEngine());
        }
        return engine;
    }

    private void ensureRootExists() {
        try {
            Files.createDirectories(catalog.getRoot());
        } catch (IOException e) {
            throw BackupOperationException.dumpFailed("Backup directory is not available: " + e.getMessage(), e);
        }
    }

    private BackupRecord readRecord(Path backup) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(backup, BasicFileAttributes.class);
            return BackupRecord.builder()
                    .filename(backup.getFileName().toString())
                    .sizeBytes(attributes.size())
                    .createdAt(attributes.lastModifiedTime().toInstant())
                    .build();
        } catch (IOException e) {
            throw BackupOperationException.dumpFailed("Backup file was not created: " + backup.getFileName(), e);
        }
    }

    private Path stageUpload(InputStream content, String stagedName) {
        Path incoming = catalog.getRoot().resolve(INCOMING_DIRECTORY);
        Path staged = incoming.resolve(stagedName);
        try {
            Files.createDirectories(incoming);
            Files.copy(content, staged, StandardCopyOption.REPLACE_EXISTING);
            log.info("[Import] Stored uploaded backup as {} ({} bytes)", stagedName, Files.size(staged));
            return staged;
        } catch (IOException e) {
            try {
                Files.deleteIfExists(staged);
            } catch (IOException cleanupError) {
                log.warn("[Import] Failed to delete partial upload {}: {}", staged, cleanupError.getMessage());
            }
            throw new UncheckedIOException("Failed to store uploaded backup", e);
        }
    }

    static String safeUploadName(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return "import" + BackupCatalog.BACKUP_EXTENSION;
        }
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
            return "import" + BackupCatalog.BACKUP_EXTENSION;
        }
        return name;
    }
}
