package com.homepage.api.model.dto;

import com.homepage.api.model.BackupWarning;
import com.homepage.api.model.RetentionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class CleanupResponse {

    private int keptCount;
    private List<String> deleted;
    private List<String> warnings;

    public static CleanupResponse fromResult(RetentionResult result) {
        return CleanupResponse.builder()
                .keptCount(result.getKept().size())
                .deleted(result.getDeleted())
                .warnings(result.getWarnings().stream()
                        .map(BackupWarning::getMessage)
                        .toList())
                .build();
    }
}
