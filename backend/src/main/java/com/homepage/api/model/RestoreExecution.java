package com.homepage.api.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Progress of a single restore through
 * PENDING, VERIFYING, DRAINING, SANITIZING, RESTORING and finally COMPLETE or FAILED.
 * Phases only move forward; no phase is retried.
 */
@Slf4j
@Getter
public class RestoreExecution {

    private final String filename;
    @Getter(AccessLevel.NONE)
    private final Clock clock;
    private final Instant startedAt;
    private final List<BackupWarning> warnings = new ArrayList<>();

    private RestoreState state = RestoreState.PENDING;
    private Instant completedAt;
    private String errorMessage;
    private long linesTotal;
    private long linesFiltered;
    private int toolErrorLines;
    private int toolWarningLines;

    public RestoreExecution(String filename, Clock clock) {
        this.filename = filename;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void transitionTo(RestoreState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Restore of " + filename + " already finished as " + state);
        }
        if (next.ordinal() <= state.ordinal() && next != RestoreState.FAILED) {
            throw new IllegalStateException("Illegal restore transition " + state + " -> " + next);
        }
        log.debug("[Restore] {}: {} -> {}", filename, state, next);
        state = next;
    }

    public void complete() {
        transitionTo(RestoreState.COMPLETE);
        completedAt = clock.instant();
    }

    public void fail(String message) {
        if (state.isTerminal()) {
            return;
        }
        transitionTo(RestoreState.FAILED);
        errorMessage = message;
        completedAt = clock.instant();
    }

    public void addWarning(BackupWarning warning) {
        warnings.add(warning);
    }

    public List<BackupWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void recordSanitize(SanitizeResult result) {
        this.linesTotal = result.getLinesTotal();
        this.linesFiltered = result.getLinesFiltered();
    }

    public void recordToolOutput(int errorLines, int warningLines) {
        this.toolErrorLines = errorLines;
        this.toolWarningLines = warningLines;
    }
}
