package com.ledgerbook.backup.service;

import java.nio.file.Path;

/**
 * Receives a verified backup archive for an owner. Swapping it in as the live
 * database requires the caller to drain open connections first.
 */
public interface DatabaseRestoreHandler {

    void restore(String ownerId, Path archive, ArchiveEntryInfo entry);
}
