package com.homepage.api.exception;

import lombok.Getter;

/**
 * Failure kinds of the backup engine.
 * Fatal kinds abort the operation and are raised as {@link BackupOperationException};
 * the others are only ever logged and reported as {@link com.homepage.api.model.BackupWarning}.
 */
@Getter
public enum BackupErrorKind {

    DUMP_FAILED(true),
    BACKUP_NOT_FOUND(true),
    SANITIZE_IO_FAILURE(true),
    RESTORE_TIMEOUT(true),
    RESTORE_FAILED(true),
    CONNECTION_DRAIN_WARNING(false),
    CLEANUP_WARNING(false);

    private final boolean fatal;

    BackupErrorKind(boolean fatal) {
        this.fatal = fatal;
    }
}
