package com.homepage.api.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class BackupOperationException extends RuntimeException {

    private final BackupErrorKind kind;

    public BackupOperationException(BackupErrorKind kind, String message) {
        this(kind, message, null);
    }

    public BackupOperationException(BackupErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (!kind.isFatal()) {
            throw new IllegalArgumentException("Non-fatal kind cannot be raised: " + kind);
        }
        this.kind = kind;
    }

    public static BackupOperationException dumpFailed(String stderr) {
        return new BackupOperationException(BackupErrorKind.DUMP_FAILED, "Backup failed: " + stderr);
    }

    public static BackupOperationException dumpFailed(String message, Throwable cause) {
        return new BackupOperationException(BackupErrorKind.DUMP_FAILED, "Backup failed: " + message, cause);
    }

    public static BackupOperationException backupNotFound(String filename) {
        return new BackupOperationException(BackupErrorKind.BACKUP_NOT_FOUND, "Backup file not found: " + filename);
    }

    public static BackupOperationException sanitizeFailed(String message, Throwable cause) {
        return new BackupOperationException(BackupErrorKind.SANITIZE_IO_FAILURE,
                "Failed to sanitize backup file: " + message, cause);
    }

    public static BackupOperationException restoreTimeout(Duration timeout) {
        return new BackupOperationException(BackupErrorKind.RESTORE_TIMEOUT,
                "Restore timed out after " + timeout.toSeconds() + " seconds. The database might be too large.");
    }

    /**
     * The message is the first fatal line reported by the restore tool, verbatim.
     */
    public static BackupOperationException restoreFailed(String firstErrorLine) {
        return new BackupOperationException(BackupErrorKind.RESTORE_FAILED, firstErrorLine);
    }

    public static BackupOperationException restoreFailed(String message, Throwable cause) {
        return new BackupOperationException(BackupErrorKind.RESTORE_FAILED, message, cause);
    }
}
