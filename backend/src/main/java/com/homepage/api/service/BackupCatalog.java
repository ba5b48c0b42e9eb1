package com.homepage.api.service;

import com.homepage.api.exception.BackupOperationException;
import com.homepage.api.model.BackupRecord;
import com.homepage.api.model.BackupWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The flat directory of backup files.
 * Only regular files ending in {@code .sql} are backups; transient
 * {@code .sql.sanitized} restore artifacts never match.
 */
@Slf4j
@Component
public class BackupCatalog {

    public static final String BACKUP_EXTENSION = ".sql";
    static final String WRITE_TEST_FILE = ".test_write";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    static final Comparator<BackupRecord> NEWEST_FIRST = Comparator
            .comparing(BackupRecord::getCreatedAt)
            .thenComparing(BackupRecord::getFilename)
            .reversed();

    @Value("${backup.directory:./data/backups}")
    private String backupDirectory;

    public Path getRoot() {
        return Path.of(backupDirectory).toAbsolutePath().normalize();
    }

    /**
     * Create the root if needed and verify it is writable.
     * Problems are logged, never thrown, so the application still starts.
     *
     * @return true if the root exists and accepted a test write
     */
    public boolean initialize() {
        Path root = getRoot();
        try {
            if (!Files.isDirectory(root)) {
                Files.createDirectories(root);
                log.info("Created backup directory at {}", root);
            }

            Path testFile = root.resolve(WRITE_TEST_FILE);
            Files.writeString(testFile, "test");
            Files.delete(testFile);
            log.info("Backup directory {} is writable", root);

            log.info("Initialized backup catalog. Found {} existing backups.", list().size());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to initialize backup directory {}: {}", root, e.getMessage());
            return false;
        }
    }

    /**
     * All backups, newest first. Entries that cannot be read are skipped.
     */
    public List<BackupRecord> list() {
        Path root = getRoot();
        List<BackupRecord> backups = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return backups;
        }

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, "*" + BACKUP_EXTENSION)) {
            for (Path entry : entries) {
                readRecord(entry).ifPresent(backups::add);
            }
        } catch (IOException e) {
            log.error("[Backup] List backups error: {}", e.getMessage());
        }

        backups.sort(NEWEST_FIRST);
        return backups;
    }

    private Optional<BackupRecord> readRecord(Path entry) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(entry, BasicFileAttributes.class);
            if (!attributes.isRegularFile()) {
                return Optional.empty();
            }
            return Optional.of(BackupRecord.builder()
                    .filename(entry.getFileName().toString())
                    .sizeBytes(attributes.size())
                    .createdAt(attributes.lastModifiedTime().toInstant())
                    .build());
        } catch (IOException e) {
            log.debug("Skipping unreadable backup entry {}: {}", entry.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Path of a backup inside the root. The name must be a plain file name.
     *
     * @throws IllegalArgumentException for names that could escape the root
     */
    public Path resolve(String filename) {
        if (filename == null || filename.isBlank()
                || filename.contains("/") || filename.contains("\\")
                || filename.equals(".") || filename.equals("..")) {
            throw new IllegalArgumentException("Invalid backup filename: " + filename);
        }

        Path root = getRoot();
        Path resolved = root.resolve(filename).normalize();
        if (!root.equals(resolved.getParent())) {
            throw new IllegalArgumentException("Invalid backup filename: " + filename);
        }
        return resolved;
    }

    /**
     * Path of an existing backup.
     *
     * @throws BackupOperationException with kind BACKUP_NOT_FOUND if absent
     */
    public Path require(String filename) {
        Path path = resolve(filename);
        if (!Files.isRegularFile(path)) {
            throw BackupOperationException.backupNotFound(filename);
        }
        return path;
    }

    /**
     * Delete a backup.
     *
     * @throws BackupOperationException with kind BACKUP_NOT_FOUND if absent
     */
    public void delete(String filename) {
        Path path = resolve(filename);
        try {
            Files.delete(path);
            log.info("[Backup] Deleted backup file: {}", filename);
        } catch (NoSuchFileException e) {
            log.warn("[Backup] File not found for deletion: {}", filename);
            throw BackupOperationException.backupNotFound(filename);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete backup " + filename, e);
        }
    }

    /**
     * Delete a backup without raising.
     *
     * @return a cleanup warning if the file could not be deleted, empty on success
     */
    public Optional<BackupWarning> deleteQuietly(String filename) {
        try {
            delete(filename);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Cleanup] Failed to delete {}: {}", filename, e.getMessage());
            return Optional.of(BackupWarning.cleanup("Failed to delete " + filename + ": " + e.getMessage()));
        }
    }

    /**
     * Path for a new backup taken at {@code timestamp}: {@code backup_yyyyMMdd_HHmmss.sql},
     * with {@code _1}, {@code _2}, ... appended when that second is already taken.
     */
    public Path nextBackupPath(LocalDateTime timestamp) {
        String base = "backup_" + timestamp.format(TIMESTAMP_FORMAT);
        Path candidate = resolve(base + BACKUP_EXTENSION);
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = resolve(base + "_" + suffix + BACKUP_EXTENSION);
            suffix++;
        }
        return candidate;
    }
}
