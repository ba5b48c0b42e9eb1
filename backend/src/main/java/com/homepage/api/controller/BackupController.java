package com.homepage.api.controller;

import com.homepage.api.model.BackupRecord;
import com.homepage.api.model.RestoreExecution;
import com.homepage.api.model.dto.BackupListResponse;
import com.homepage.api.model.dto.BackupResponse;
import com.homepage.api.model.dto.CleanupResponse;
import com.homepage.api.model.dto.RestoreResponse;
import com.homepage.api.service.BackupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/system")
@RequiredArgsConstructor
@Tag(name = "Backups", description = "Database backup and restore")
public class BackupController {

    private final BackupService backupService;

    @PostMapping("/backup")
    @Operation(summary = "Create a backup of the configured database and apply retention")
    public ResponseEntity<BackupResponse> createBackup() {
        BackupRecord record = backupService.createBackup();
        return ResponseEntity.status(HttpStatus.CREATED).body(BackupResponse.fromRecord(record));
    }

    @GetMapping("/backups")
    @Operation(summary = "List backups, newest first")
    public ResponseEntity<BackupListResponse> listBackups() {
        return ResponseEntity.ok(BackupListResponse.fromRecords(backupService.listBackups()));
    }

    @PostMapping("/backups/{filename}/restore")
    @Operation(summary = "Restore the database from a backup (destructive)")
    public ResponseEntity<RestoreResponse> restoreBackup(@PathVariable String filename) {
        RestoreExecution execution = backupService.restoreBackup(filename);
        return ResponseEntity.ok(RestoreResponse.fromExecution(execution));
    }

    @DeleteMapping("/backups/{filename}")
    @Operation(summary = "Delete a backup")
    public ResponseEntity<Map<String, String>> deleteBackup(@PathVariable String filename) {
        backupService.deleteBackup(filename);
        return ResponseEntity.ok(Map.of("message", "Backup " + filename + " deleted"));
    }

    @GetMapping("/backups/{filename}/download")
    @Operation(summary = "Download a backup file")
    public ResponseEntity<Resource> downloadBackup(@PathVariable String filename) {
        Path path = backupService.resolveForDownload(filename);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(new FileSystemResource(path));
    }

    @PostMapping("/backups/cleanup")
    @Operation(summary = "Apply the retention policy now")
    public ResponseEntity<CleanupResponse> cleanupBackups() {
        return ResponseEntity.ok(CleanupResponse.fromResult(backupService.cleanupBackups()));
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a dump and restore the database from it (destructive)")
    public ResponseEntity<RestoreResponse> importBackup(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded backup file is empty");
        }
        try (InputStream content = file.getInputStream()) {
            RestoreExecution execution = backupService.importBackup(content, file.getOriginalFilename());
            return ResponseEntity.ok(RestoreResponse.fromExecution(execution));
        }
    }
}
