package com.homepage.api.model;

import com.homepage.api.exception.BackupErrorKind;
import lombok.Data;

/**
 * A recovered, non-fatal problem that was logged and did not abort the operation.
 */
@Data
public class BackupWarning {

    private final BackupErrorKind kind;
    private final String message;

    public static BackupWarning connectionDrain(String message) {
        return new BackupWarning(BackupErrorKind.CONNECTION_DRAIN_WARNING, message);
    }

    public static BackupWarning cleanup(String message) {
        return new BackupWarning(BackupErrorKind.CLEANUP_WARNING, message);
    }
}
