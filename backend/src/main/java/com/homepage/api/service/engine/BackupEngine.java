package com.homepage.api.service.engine;

import com.homepage.api.model.DatabaseEngine;
import com.homepage.api.model.ResolvedConnection;
import com.homepage.api.model.RestoreExecution;

import java.nio.file.Path;

/**
 * Dump and restore capability of one database engine.
 * Exactly one implementation exists per {@link DatabaseEngine}.
 */
public interface BackupEngine {

    DatabaseEngine getEngine();

    /**
     * Write a complete dump of the database to {@code destination}.
     * On failure no partial file is left behind.
     *
     * @throws com.homepage.api.exception.BackupOperationException with kind DUMP_FAILED
     */
    void dump(ResolvedConnection connection, Path destination);

    /**
     * Replay {@code source} against the database, advancing {@code execution} through
     * the restore phases. The caller has already verified that {@code source} exists
     * and is responsible for the terminal COMPLETE or FAILED transition.
     */
    void restore(ResolvedConnection connection, Path source, RestoreExecution execution);
}
