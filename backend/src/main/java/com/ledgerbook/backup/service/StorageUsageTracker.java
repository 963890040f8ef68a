package com.ledgerbook.backup.service;

/**
 * Account-side record of how much backup storage an owner uses.
 */
public interface StorageUsageTracker {

    long getStorageUsage(String ownerId);

    /**
     * Replace the recorded usage for an owner.
     */
    void setStorageUsage(String ownerId, long bytes);
}
