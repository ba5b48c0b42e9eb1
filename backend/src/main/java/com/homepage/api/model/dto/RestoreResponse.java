package com.homepage.api.model.dto;

import com.homepage.api.model.BackupWarning;
import com.homepage.api.model.RestoreExecution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a restore. Only successful restores are returned; failures surface as error bodies.
 */
@Data
@Builder
@AllArgsConstructor
public class RestoreResponse {

    private String message;
    private String filename;
    private String state;
    private Instant startedAt;
    private Instant completedAt;
    private long linesTotal;
    private long linesFiltered;
    private int toolWarningLines;
    private List<String> warnings;

    public static RestoreResponse fromExecution(RestoreExecution execution) {
        return RestoreResponse.builder()
                .message("Restore from " + execution.getFilename() + " completed successfully")
                .filename(execution.getFilename())
                .state(execution.getState().name())
                .startedAt(execution.getStartedAt())
                .completedAt(execution.getCompletedAt())
                .linesTotal(execution.getLinesTotal())
                .linesFiltered(execution.getLinesFiltered())
                .toolWarningLines(execution.getToolWarningLines())
                .warnings(execution.getWarnings().stream()
                        .map(BackupWarning::getMessage)
                        .toList())
                .build();
    }
}
