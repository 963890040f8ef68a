package com.ledgerbook.backup.model.dto;

import com.ledgerbook.backup.model.BackupRecord;
import com.ledgerbook.backup.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class BackupRecordResponse {

    private String id;
    private String name;
    private long sizeBytes;
    private String formattedSize;
    private Instant createdAt;

    public static BackupRecordResponse fromRecord(BackupRecord record) {
        return BackupRecordResponse.builder()
                .id(record.getId())
                .name(record.getDisplayName())
                .sizeBytes(record.getSizeBytes())
                .formattedSize(FormatUtils.formatBytes(record.getSizeBytes()))
                .createdAt(record.getCreatedAt())
                .build();
    }
}
