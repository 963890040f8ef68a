package com.ledgerbook.backup.model.dto;

import com.ledgerbook.backup.model.BackupRecord;
import com.ledgerbook.backup.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class BackupListResponse {

    private List<BackupRecordResponse> backups;
    private int count;
    private long totalSizeBytes;
    private String formattedTotalSize;

    public static BackupListResponse fromRecords(List<BackupRecord> records) {
        List<BackupRecordResponse> responses = records.stream()
                .map(BackupRecordResponse::fromRecord)
                .toList();

        long totalSize = records.stream()
                .mapToLong(BackupRecord::getSizeBytes)
                .sum();

        return BackupListResponse.builder()
                .backups(responses)
                .count(responses.size())
                .totalSizeBytes(totalSize)
                .formattedTotalSize(FormatUtils.formatBytes(totalSize))
                .build();
    }
}
