package com.ledgerbook.backup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Comparator;

/**
 * A stored backup archive as reported by the active storage backend.
 * Derived from listing metadata, never persisted on its own.
 */
@Data
@Builder
@AllArgsConstructor
public class BackupRecord {

    public static final Comparator<BackupRecord> NEWEST_FIRST = Comparator
            .comparing(BackupRecord::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(BackupRecord::getId, Comparator.nullsLast(Comparator.<String>reverseOrder()));

    /** Backend-specific name, passed back verbatim on restore. */
    private String id;
    private String displayName;
    private long sizeBytes;
    private Instant createdAt;
}
