package com.homepage.api.model;

import java.util.Locale;

public enum DatabaseEngine {

    POSTGRESQL,
    SQLITE;

    /**
     * Map a URL scheme (driver suffix already removed) to an engine.
     */
    public static DatabaseEngine fromScheme(String scheme) {
        if (scheme == null) {
            throw new IllegalArgumentException("Connection string has no scheme");
        }
        return switch (scheme.toLowerCase(Locale.ROOT)) {
            case "postgresql", "postgres" -> POSTGRESQL;
            case "sqlite" -> SQLITE;
            default -> throw new IllegalArgumentException(
                    "Unsupported database scheme: " + scheme + ". Supported: postgresql, sqlite");
        };
    }
}
