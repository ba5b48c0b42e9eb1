package com.homepage.api.util;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits restore-tool diagnostics into fatal errors and tolerable warnings.
 */
public final class RestoreOutputClassifier {

    private static final List<String> FATAL_MARKERS = List.of("ERROR:", "FATAL:", "PANIC:", "psql: error:");
    private static final List<String> WARNING_MARKERS = List.of("WARNING:", "NOTICE:");

    private RestoreOutputClassifier() {
        // Utility class - prevent instantiation
    }

    /**
     * Classify every line of the tool's stderr.
     *
     * @param stderr Captured stderr, may be null
     * @return Fatal and warning lines in output order
     */
    public static Classification classify(String stderr) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (stderr == null || stderr.isEmpty()) {
            return new Classification(errors, warnings);
        }

        for (String rawLine : stderr.split("\n")) {
            String line = stripCarriageReturn(rawLine);
            if (containsAny(line, FATAL_MARKERS)) {
                errors.add(line);
            } else if (containsAny(line, WARNING_MARKERS)) {
                warnings.add(line);
            }
        }
        return new Classification(errors, warnings);
    }

    private static boolean containsAny(String line, List<String> markers) {
        for (String marker : markers) {
            if (line.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    @Getter
    public static final class Classification {

        private final List<String> errorLines;
        private final List<String> warningLines;

        private Classification(List<String> errorLines, List<String> warningLines) {
            this.errorLines = List.copyOf(errorLines);
            this.warningLines = List.copyOf(warningLines);
        }

        public boolean hasErrors() {
            return !errorLines.isEmpty();
        }

        public Optional<String> firstError() {
            return errorLines.stream().findFirst();
        }

        /**
         * At most {@code max} leading lines, for log summaries.
         */
        public static List<String> head(List<String> lines, int max) {
            return lines.subList(0, Math.min(max, lines.size()));
        }
    }
}
