package com.ledgerbook.backup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class StorageUsage {

    private long usedBytes;
    private long limitBytes;
    private double percentage;
    private DeploymentMode mode;

    public static StorageUsage of(long usedBytes, long limitBytes, DeploymentMode mode) {
        double percentage = limitBytes > 0 ? (usedBytes * 100.0) / limitBytes : 0.0;
        return new StorageUsage(usedBytes, limitBytes, percentage, mode);
    }
}
