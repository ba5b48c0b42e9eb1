package com.homepage.api.util;

/**
 * Shortens captured tool output for log lines.
 */
public final class OutputSummary {

    private OutputSummary() {
        // Utility class - prevent instantiation
    }

    /**
     * First line of {@code text}, followed by the number of lines left out.
     *
     * @param text Multi-line text, may be null
     * @return e.g. {@code "pg_dump: error: connection refused (+3 more lines)"}, or "" for null
     */
    public static String summarize(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        if (newline < 0) {
            return trimmed;
        }
        String first = trimmed.substring(0, newline).stripTrailing();
        long remaining = trimmed.substring(newline + 1).lines().count();
        return first + " (+" + remaining + " more lines)";
    }
}
