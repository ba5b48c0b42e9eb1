package com.homepage.api.service;

import com.homepage.api.model.ConnectionParams;
import com.homepage.api.model.DatabaseEngine;
import com.homepage.api.model.ResolvedConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Parses {@code scheme://[user[:password]@]host[:port]/database} connection strings.
 * The password is percent-decoded and returned only through
 * {@link ResolvedConnection#childEnvironment()}, never inside the clean URL.
 */
@Slf4j
@Component
public class ConnectionResolver {

    static final String DEFAULT_USERNAME = "homepage";
    static final String DEFAULT_HOST = "db";
    static final int DEFAULT_PORT = 5432;
    static final String DEFAULT_DATABASE = "homepage";

    private static final String SCHEME_SEPARATOR = "://";

    public ResolvedConnection resolve(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Database connection string is not configured");
        }

        String normalized = url.strip();
        if (normalized.startsWith("jdbc:")) {
            normalized = normalized.substring("jdbc:".length());
        }

        int separator = normalized.indexOf(SCHEME_SEPARATOR);
        if (separator <= 0) {
            throw new IllegalArgumentException("Connection string has no scheme");
        }

        // postgresql+asyncpg -> postgresql
        String scheme = normalized.substring(0, separator);
        int driverSuffix = scheme.indexOf('+');
        if (driverSuffix > 0) {
            scheme = scheme.substring(0, driverSuffix);
        }

        DatabaseEngine engine = DatabaseEngine.fromScheme(scheme);
        String remainder = normalized.substring(separator + SCHEME_SEPARATOR.length());

        return switch (engine) {
            case SQLITE -> resolveSqlite(scheme, remainder);
            case POSTGRESQL -> resolveServer(engine, remainder);
        };
    }

    private ResolvedConnection resolveSqlite(String scheme, String remainder) {
        // sqlite:///relative.db leaves "/relative.db", sqlite:////abs.db leaves "//abs.db"
        String location = stripQuery(remainder);
        if (location.startsWith("/")) {
            location = location.substring(1);
        }
        if (location.isEmpty()) {
            throw new IllegalArgumentException("SQLite connection string has no database file");
        }

        Path file = Path.of(location);
        if (!file.isAbsolute()) {
            file = Path.of("").toAbsolutePath().resolve(file);
        }
        file = file.normalize();

        ConnectionParams params = ConnectionParams.builder()
                .scheme(scheme)
                .username("")
                .password("")
                .host("")
                .port(0)
                .database(file.toString())
                .build();

        return ResolvedConnection.builder()
                .engine(DatabaseEngine.SQLITE)
                .params(params)
                .cleanUrl(file.toString())
                .build();
    }

    private ResolvedConnection resolveServer(DatabaseEngine engine, String remainder) {
        String userInfo = null;
        String hostAndPath = remainder;

        int at = remainder.lastIndexOf('@');
        if (at >= 0) {
            userInfo = remainder.substring(0, at);
            hostAndPath = remainder.substring(at + 1);
        }

        String hostPort = hostAndPath;
        String path = "";
        int slash = hostAndPath.indexOf('/');
        if (slash >= 0) {
            hostPort = hostAndPath.substring(0, slash);
            path = stripQuery(hostAndPath.substring(slash + 1));
        }

        String username = null;
        String password = null;
        if (userInfo != null) {
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                username = userInfo.substring(0, colon);
                password = percentDecode(userInfo.substring(colon + 1));
            } else {
                username = userInfo;
            }
        }

        String host = hostPort;
        String portText = "";
        if (hostPort.startsWith("[")) {
            // [::1] or [::1]:5433
            int close = hostPort.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated IPv6 host in connection string");
            }
            host = hostPort.substring(1, close);
            String rest = hostPort.substring(close + 1);
            if (rest.startsWith(":")) {
                portText = rest.substring(1);
            } else if (!rest.isEmpty()) {
                throw new IllegalArgumentException("Unexpected text after IPv6 host: " + rest);
            }
        } else {
            int colon = hostPort.lastIndexOf(':');
            if (colon >= 0) {
                host = hostPort.substring(0, colon);
                portText = hostPort.substring(colon + 1);
            }
        }
        int port = portText.isEmpty() ? DEFAULT_PORT : parsePort(portText);

        ConnectionParams params = ConnectionParams.builder()
                .scheme("postgresql")
                .username(isEmpty(username) ? DEFAULT_USERNAME : username)
                .password(password == null ? "" : password)
                .host(isEmpty(host) ? DEFAULT_HOST : host)
                .port(port)
                .database(isEmpty(path) ? DEFAULT_DATABASE : path)
                .build();

        String urlHost = params.getHost().indexOf(':') >= 0 ? "[" + params.getHost() + "]" : params.getHost();
        String cleanUrl = String.format("postgresql://%s@%s:%d/%s",
                params.getUsername(), urlHost, params.getPort(), params.getDatabase());

        log.debug("[DB] Prepared connection: host={}, port={}, db={}, user={}",
                params.getHost(), params.getPort(), params.getDatabase(), params.getUsername());

        return ResolvedConnection.builder()
                .engine(engine)
                .params(params)
                .cleanUrl(cleanUrl)
                .build();
    }

    private int parsePort(String portText) {
        try {
            int port = Integer.parseInt(portText);
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in connection string: " + portText, e);
        }
    }

    /**
     * Decodes valid {@code %XX} escapes as UTF-8 bytes. A '%' not followed by two hex
     * digits is kept as is, and '+' stays a literal plus.
     */
    static String percentDecode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%' && i + 2 < value.length() && isHexPair(value, i + 1)) {
                bytes.write(Character.digit(value.charAt(i + 1), 16) << 4 | Character.digit(value.charAt(i + 2), 16));
                i += 3;
                continue;
            }
            int codePoint = value.codePointAt(i);
            bytes.writeBytes(new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8));
            i += Character.charCount(codePoint);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static boolean isHexPair(String value, int from) {
        return Character.digit(value.charAt(from), 16) >= 0
                && Character.digit(value.charAt(from + 1), 16) >= 0;
    }

    private String stripQuery(String value) {
        int query = value.indexOf('?');
        return query >= 0 ? value.substring(0, query) : value;
    }

    private boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
