package com.homepage.api.service;

import com.homepage.api.exception.BackupOperationException;
import com.homepage.api.model.SanitizationRule;
import com.homepage.api.model.SanitizeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Removes version-specific and provider-proprietary directives from a SQL dump so it
 * can be replayed against a different server version.
 * The dump is treated as opaque bytes: lines are split on '\n' and never decoded, so
 * binary column data passes through untouched.
 */
@Slf4j
@Component
public class SqlDumpSanitizer {

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final int INITIAL_LINE_CAPACITY = 1024;
    private static final int PREVIEW_LENGTH = 50;

    /**
     * Copy {@code input} to {@code output}, dropping lines matched by any rule.
     * The input is never modified. On failure the partial output is deleted.
     */
    public SanitizeResult sanitize(Path input, Path output, List<SanitizationRule> rules) {
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Sanitized output must not overwrite the input dump: " + input);
        }

        log.info("[Sanitize] Sanitizing {} for cross-version compatibility...", input.getFileName());

        InputStream source;
        try {
            source = Files.newInputStream(input);
        } catch (IOException e) {
            log.error("[Sanitize] Cannot open {}: {}", input.getFileName(), e.getMessage());
            deletePartialOutput(output);
            throw BackupOperationException.sanitizeFailed(e.getMessage(), e);
        }
        return sanitize(source, input.getFileName().toString(), output, rules);
    }

    /**
     * Stream variant of {@link #sanitize(Path, Path, List)}. Closes {@code source}.
     */
    SanitizeResult sanitize(InputStream source, String sourceName, Path output, List<SanitizationRule> rules) {
        long linesTotal = 0;
        long linesFiltered = 0;

        try (InputStream in = new BufferedInputStream(source, BUFFER_SIZE);
             OutputStream out = new BufferedOutputStream(Files.newOutputStream(output), BUFFER_SIZE)) {

            LineBuffer line = new LineBuffer();
            while (line.readFrom(in)) {
                linesTotal++;
                SanitizationRule match = findMatch(line, rules);
                if (match != null) {
                    linesFiltered++;
                    if (log.isDebugEnabled()) {
                        log.debug("[Sanitize] Filtered {}: {}", match.getCategory(), line.preview(PREVIEW_LENGTH));
                    }
                } else {
                    line.writeTo(out);
                }
            }

        } catch (IOException e) {
            log.error("[Sanitize] Sanitization of {} failed after {} lines: {}", sourceName, linesTotal, e.getMessage());
            deletePartialOutput(output);
            throw BackupOperationException.sanitizeFailed(e.getMessage(), e);
        } catch (RuntimeException e) {
            deletePartialOutput(output);
            throw e;
        }

        log.info("[Sanitize] Sanitization complete: {} lines filtered from {} total", linesFiltered, linesTotal);
        return new SanitizeResult(linesTotal, linesFiltered);
    }

    private SanitizationRule findMatch(LineBuffer line, List<SanitizationRule> rules) {
        int start = line.contentStart();
        int end = line.contentEnd();
        for (SanitizationRule rule : rules) {
            if (rule.matches(line.bytes, start, end)) {
                return rule;
            }
        }
        return null;
    }

    private void deletePartialOutput(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException cleanupError) {
            log.warn("[Sanitize] Failed to delete partial output {}: {}", output, cleanupError.getMessage());
        }
    }

    /**
     * One line including its terminator, reused across reads.
     */
    private static final class LineBuffer {

        private byte[] bytes = new byte[INITIAL_LINE_CAPACITY];
        private int length;

        boolean readFrom(InputStream in) throws IOException {
            length = 0;
            int b;
            while ((b = in.read()) != -1) {
                append((byte) b);
                if (b == '\n') {
                    return true;
                }
            }
            return length > 0;
        }

        void writeTo(OutputStream out) throws IOException {
            out.write(bytes, 0, length);
        }

        int contentStart() {
            int i = 0;
            while (i < length && isWhitespace(bytes[i])) {
                i++;
            }
            return i;
        }

        int contentEnd() {
            int i = length;
            while (i > 0 && isWhitespace(bytes[i - 1])) {
                i--;
            }
            return i;
        }

        String preview(int max) {
            int start = contentStart();
            int end = Math.max(start, Math.min(contentEnd(), start + max));
            return new String(bytes, start, end - start, StandardCharsets.UTF_8);
        }

        private void append(byte b) {
            if (length == bytes.length) {
                bytes = Arrays.copyOf(bytes, bytes.length * 2);
            }
            bytes[length++] = b;
        }

        private static boolean isWhitespace(byte b) {
            return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0B || b == '\f';
        }
    }
}
