package com.ledgerbook.backup.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local usage tracker. Deployments backed by an account database
 * provide their own {@link StorageUsageTracker}.
 */
@Slf4j
@Component
public class InMemoryStorageUsageTracker implements StorageUsageTracker {

    private final Map<String, Long> usage = new ConcurrentHashMap<>();

    @Override
    public long getStorageUsage(String ownerId) {
        return usage.getOrDefault(ownerId, 0L);
    }

    @Override
    public void setStorageUsage(String ownerId, long bytes) {
        usage.put(ownerId, bytes);
        log.debug("Storage usage for {} set to {} bytes", ownerId, bytes);
    }
}
