package com.ledgerbook.backup.config;

import com.ledgerbook.backup.storage.BackendResolution;
import com.ledgerbook.backup.storage.LocalStorageBackend;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Validates backup configuration on application startup.
 * Fails fast if local directories cannot be created.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupValidator {

    private final BackendResolution backendResolution;

    @Value("${backup.database-path:database.db}")
    private String databasePath;

    @Value("${backup.staging-dir:${java.io.tmpdir}/ledger-backup-staging}")
    private String stagingDir;

    @PostConstruct
    public void validate() {
        log.info("Validating backup configuration...");

        validateDatabasePath();
        validateDirectories();

        log.info("Backup configuration validation complete ({} mode)", backendResolution.mode().label());
    }

    private void validateDatabasePath() {
        if (databasePath == null || databasePath.isBlank()) {
            throw new IllegalStateException("DATABASE_PATH must be configured for backups");
        }

        File databaseFile = new File(databasePath);
        if (!databaseFile.exists()) {
            log.warn("Database file does not exist at: {}. Backups will fail until it is created.", databasePath);
        } else if (!databaseFile.canRead()) {
            throw new IllegalStateException("Database file exists but is not readable: " + databasePath);
        } else {
            log.info("Database file validated: {}", databasePath);
        }
    }

    private void validateDirectories() {
        createDirectory(Path.of(stagingDir), "staging");
        if (backendResolution.backend() instanceof LocalStorageBackend local) {
            createDirectory(local.getRoot(), "local backup");
        }
    }

    private void createDirectory(Path directory, String purpose) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create " + purpose + " directory " + directory + ": " + e.getMessage(), e);
        }
    }
}
