package com.ledgerbook.backup.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Restore handler that only records what would be restored. The live database
 * file is left untouched.
 */
@Slf4j
@Component
public class LoggingRestoreHandler implements DatabaseRestoreHandler {

    @Value("${backup.database-path:database.db}")
    private String databasePath;

    @Override
    public void restore(String ownerId, Path archive, ArchiveEntryInfo entry) {
        log.info("[Restore] Would restore {} ({} bytes) for owner {} from {} to {}",
                entry.entryName(), entry.uncompressedSize(), ownerId, archive.getFileName(), databasePath);
    }
}
