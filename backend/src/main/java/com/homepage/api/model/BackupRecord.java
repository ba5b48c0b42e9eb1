package com.homepage.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A dump file in the backup root. Identity is the filename.
 */
@Data
@Builder
@AllArgsConstructor
public class BackupRecord {

    private String filename;
    private long sizeBytes;
    private Instant createdAt;
}
