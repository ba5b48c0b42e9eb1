package com.homepage.api.config;

import com.homepage.api.model.ResolvedConnection;
import com.homepage.api.service.BackupCatalog;
import com.homepage.api.service.ConnectionResolver;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Validates backup configuration on application startup.
 * A malformed database URL fails fast; an unusable backup directory is only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupValidator {

    private final BackupCatalog catalog;
    private final ConnectionResolver connectionResolver;

    @Value("${backup.database-url:sqlite:///./data/homepage.db}")
    private String databaseUrl;

    @PostConstruct
    public void validate() {
        log.info("Validating startup configuration...");

        validateDatabaseUrl();
        validateBackupDirectory();

        log.info("Startup configuration validation complete");
    }

    private void validateDatabaseUrl() {
        ResolvedConnection connection;
        try {
            connection = connectionResolver.resolve(databaseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("backup.database-url is invalid: " + e.getMessage(), e);
        }

        switch (connection.getEngine()) {
            case POSTGRESQL -> log.info("Backup target: PostgreSQL database '{}' on {}:{} as {}{}",
                    connection.getParams().getDatabase(),
                    connection.getParams().getHost(),
                    connection.getParams().getPort(),
                    connection.getParams().getUsername(),
                    connection.getParams().hasPassword() ? " (password supplied)" : "");
            case SQLITE -> log.info("Backup target: SQLite database file {}", connection.getCleanUrl());
        }
    }

    private void validateBackupDirectory() {
        if (!catalog.initialize()) {
            log.warn("Backup directory {} is not usable. Backups will fail until this is fixed.",
                    catalog.getRoot());
        }
    }
}
