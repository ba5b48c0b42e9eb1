package com.homepage.api.model.dto;

import com.homepage.api.model.BackupRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class BackupListResponse {

    private List<BackupResponse> backups;
    private int count;
    private long totalSizeBytes;

    public static BackupListResponse fromRecords(List<BackupRecord> records) {
        List<BackupResponse> responses = records.stream()
                .map(BackupResponse::fromRecord)
                .toList();

        long totalSize = records.stream()
                .mapToLong(BackupRecord::getSizeBytes)
                .sum();

        return BackupListResponse.builder()
                .backups(responses)
                .count(responses.size())
                .totalSizeBytes(totalSize)
                .build();
    }
}
