package com.homepage.api.model.dto;

import com.homepage.api.model.BackupRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class BackupResponse {

    private String filename;
    private long sizeBytes;
    private Instant createdAt;

    public static BackupResponse fromRecord(BackupRecord record) {
        return BackupResponse.builder()
                .filename(record.getFilename())
                .sizeBytes(record.getSizeBytes())
                .createdAt(record.getCreatedAt())
                .build();
    }
}
