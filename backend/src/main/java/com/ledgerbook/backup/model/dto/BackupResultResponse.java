package com.ledgerbook.backup.model.dto;

import com.ledgerbook.backup.model.BackupResult;
import com.ledgerbook.backup.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class BackupResultResponse {

    private boolean success;
    private String backupId;
    private long sizeBytes;
    private String formattedSize;
    private String message;

    public static BackupResultResponse fromResult(BackupResult result) {
        return BackupResultResponse.builder()
                .success(result.isSuccess())
                .backupId(result.getBackupId())
                .sizeBytes(result.getSizeBytes())
                .formattedSize(FormatUtils.formatBytes(result.getSizeBytes()))
                .message(result.getMessage())
                .build();
    }
}
