package com.ledgerbook.backup.model.dto;

import com.ledgerbook.backup.model.StorageUsage;
import com.ledgerbook.backup.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class StorageUsageResponse {

    private long used;
    private long limit;
    private double percentage;
    private String formattedUsed;
    private String formattedLimit;
    private String formattedPercentage;
    private String mode;

    public static StorageUsageResponse fromUsage(StorageUsage usage) {
        return StorageUsageResponse.builder()
                .used(usage.getUsedBytes())
                .limit(usage.getLimitBytes())
                .percentage(usage.getPercentage())
                .formattedUsed(FormatUtils.formatBytes(usage.getUsedBytes()))
                .formattedLimit(FormatUtils.formatBytes(usage.getLimitBytes()))
                .formattedPercentage(FormatUtils.formatPercentage(usage.getPercentage()))
                .mode(usage.getMode().label())
                .build();
    }
}
