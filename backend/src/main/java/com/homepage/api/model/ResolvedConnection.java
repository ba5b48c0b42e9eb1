package com.homepage.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Connection parameters of one operation, with the secret kept apart from the
 * clean URL that is safe to place on a command line.
 */
@Getter
@Builder
@ToString
public class ResolvedConnection {

    public static final String PASSWORD_ENV_VAR = "PGPASSWORD";

    private final DatabaseEngine engine;
    private final ConnectionParams params;

    /**
     * Credentials-free URL, {@code scheme://user@host:port/db} for server engines
     * and the database file path for SQLite.
     */
    private final String cleanUrl;

    /**
     * Environment entries for the child process. Holds the secret, if any.
     */
    public Map<String, String> childEnvironment() {
        if (params.hasPassword()) {
            return Map.of(PASSWORD_ENV_VAR, params.getPassword());
        }
        return Map.of();
    }
}
