package com.ledgerbook.backup.controller;

import com.ledgerbook.backup.exception.ApiException;
import com.ledgerbook.backup.model.BackupResult;
import com.ledgerbook.backup.model.dto.BackupListResponse;
import com.ledgerbook.backup.model.dto.BackupResultResponse;
import com.ledgerbook.backup.model.dto.RestoreRequest;
import com.ledgerbook.backup.model.dto.StorageUsageResponse;
import com.ledgerbook.backup.service.BackupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/backups")
@RequiredArgsConstructor
@Tag(name = "Backups", description = "Database backup and restore")
public class BackupController {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final BackupService backupService;

    @PostMapping
    @Operation(summary = "Back up the owner's database")
    public CompletableFuture<ResponseEntity<BackupResultResponse>> createBackup(
            @RequestHeader(OWNER_HEADER) String ownerId) {
        return backupService.createBackupAsync(ownerId).thenApply(this::toCreatedResponse);
    }

    @GetMapping
    @Operation(summary = "List the owner's backups, newest first")
    public CompletableFuture<ResponseEntity<BackupListResponse>> listBackups(
            @RequestHeader(OWNER_HEADER) String ownerId) {
        return backupService.listBackupsAsync(ownerId)
                .thenApply(records -> ResponseEntity.ok(BackupListResponse.fromRecords(records)));
    }

    @PostMapping("/restore")
    @Operation(summary = "Restore the owner's database from a backup")
    public CompletableFuture<ResponseEntity<Map<String, String>>> restoreBackup(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @Valid @RequestBody RestoreRequest request) {
        return backupService.restoreBackupAsync(ownerId, request.getBackupId()).thenApply(restored -> {
            if (!Boolean.TRUE.equals(restored)) {
                throw new ApiException("Restore failed", HttpStatus.BAD_REQUEST);
            }
            return ResponseEntity.ok(Map.of("message", "Restore initiated"));
        });
    }

    @GetMapping("/storage")
    @Operation(summary = "Get the owner's backup storage usage")
    public ResponseEntity<StorageUsageResponse> getStorageUsage(
            @RequestHeader(OWNER_HEADER) String ownerId) {
        return ResponseEntity.ok(StorageUsageResponse.fromUsage(backupService.getStorageUsage(ownerId)));
    }

    private ResponseEntity<BackupResultResponse> toCreatedResponse(BackupResult result) {
        if (!result.isSuccess()) {
            throw new ApiException(result.getMessage(), HttpStatus.BAD_REQUEST);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(BackupResultResponse.fromResult(result));
    }
}
