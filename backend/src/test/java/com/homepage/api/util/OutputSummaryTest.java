package com.homepage.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OutputSummary")
class OutputSummaryTest {

    @Test
    @DisplayName("should keep the first line and count the rest")
    void shouldSummarizeMultiLineOutput() {
        String stderr = "pg_dump: error: connection failed\r\nDETAIL: one\nDETAIL: two\n";

        assertThat(OutputSummary.summarize(stderr)).isEqualTo("pg_dump: error: connection failed (+2 more lines)");
    }

    @Test
    @DisplayName("should return single-line output unchanged apart from trimming")
    void shouldKeepSingleLine() {
        assertThat(OutputSummary.summarize("  psql: error: timeout \n")).isEqualTo("psql: error: timeout");
    }

    @Test
    @DisplayName("should return an empty string for missing output")
    void shouldHandleNull() {
        assertThat(OutputSummary.summarize(null)).isEmpty();
        assertThat(OutputSummary.summarize("")).isEmpty();
    }
}
