package com.ledgerbook.backup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a backup request. Failures are reported here instead of thrown.
 */
@Data
@Builder
@AllArgsConstructor
public class BackupResult {

    private boolean success;
    private long sizeBytes;
    private String message;

    /** Stored name of the new archive, null when the backup failed. */
    private String backupId;

    public static BackupResult succeeded(String backupId, long sizeBytes, DeploymentMode mode) {
        return BackupResult.builder()
                .success(true)
                .backupId(backupId)
                .sizeBytes(sizeBytes)
                .message("Backup successful (" + mode.label() + ")")
                .build();
    }

    public static BackupResult failed(String message) {
        return BackupResult.builder()
                .success(false)
                .sizeBytes(0)
                .message(message)
                .build();
    }
}
