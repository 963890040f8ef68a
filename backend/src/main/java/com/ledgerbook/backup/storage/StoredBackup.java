package com.ledgerbook.backup.storage;

/**
 * Where a backend put an archive and how large it was.
 */
public record StoredBackup(String storedId, long sizeBytes) {}
