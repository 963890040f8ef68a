package com.ledgerbook.backup.service;

import com.ledgerbook.backup.exception.BackendProvisioningException;
import com.ledgerbook.backup.exception.BackupIOException;
import com.ledgerbook.backup.exception.BackupNotFoundException;
import com.ledgerbook.backup.exception.SourceMissingException;
import com.ledgerbook.backup.model.BackupRecord;
import com.ledgerbook.backup.model.BackupResult;
import com.ledgerbook.backup.model.DeploymentMode;
import com.ledgerbook.backup.model.StorageUsage;
import com.ledgerbook.backup.storage.OwnerNamespace;
import com.ledgerbook.backup.storage.ResolvedArchive;
import com.ledgerbook.backup.storage.StorageBackend;
import com.ledgerbook.backup.storage.StoredBackup;
import com.ledgerbook.backup.util.FormatUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for snapshotting and restoring an owner's embedded database.
 * Builds a compressed archive of the database file, hands it to whichever
 * storage backend was selected at startup (remote object storage or local disk)
 * and records the owner's storage usage. Failures are reported through result
 * values; nothing thrown inside reaches the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupService {

    static final String PROVISIONING_FAILURE_PREFIX = "Remote storage provisioning failed: ";
    static final String BACKUP_IN_PROGRESS_MESSAGE =
            "A backup is already in progress for this account. Please wait for it to complete.";

    private final StorageBackend storageBackend;
    private final ArchiveBuilder archiveBuilder;
    private final StorageUsageTracker storageUsageTracker;
    private final DatabaseRestoreHandler restoreHandler;
    private final Clock clock;

    @Value("${backup.database-path:database.db}")
    private String databasePath;

    @Value("${backup.staging-dir:${java.io.tmpdir}/ledger-backup-staging}")
    private String stagingDir;

    @Value("${backup.storage-limit-bytes:16106127360}")
    private long storageLimitBytes;

    // Owners with a backup currently being built or uploaded
    private final Set<String> ownersInFlight = ConcurrentHashMap.newKeySet();

    public DeploymentMode getMode() {
        return storageBackend.mode();
    }

    /**
     * Create a backup of the database for an owner.
     *
     * @return success with the archive size, or failure with a description; never throws
     */
    public BackupResult createBackup(String ownerId) {
        String owner;
        try {
            owner = OwnerNamespace.requireOwnerId(ownerId);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected backup request: {}", e.getMessage());
            return BackupResult.failed(e.getMessage());
        }

        if (!ownersInFlight.add(owner)) {
            log.warn("Backup already in progress for owner {}", owner);
            return BackupResult.failed(BACKUP_IN_PROGRESS_MESSAGE);
        }

        Path staging = null;
        try {
            log.info("[Backup] Starting backup for owner {} ({} mode)", owner, getMode().label());

            Path source = Path.of(databasePath);
            if (!Files.isRegularFile(source)) {
                throw new SourceMissingException(source);
            }

            staging = stagingFile(owner);
            archiveBuilder.build(source, staging);

            long size = archiveSize(staging);
            log.info("[Backup] Archive created: {} ({})", staging.getFileName(), FormatUtils.formatBytes(size));

            StoredBackup stored = storageBackend.put(owner, staging);
            storageUsageTracker.setStorageUsage(owner, size);

            log.info("[Backup] Backup {} stored for owner {}", stored.storedId(), owner);
            return BackupResult.succeeded(stored.storedId(), size, getMode());
        } catch (BackendProvisioningException e) {
            log.error("[Backup] Remote storage provisioning failed for owner {}: {}", owner, e.getMessage(), e);
            return BackupResult.failed(PROVISIONING_FAILURE_PREFIX + e.getMessage());
        } catch (SourceMissingException e) {
            log.error("[Backup] Backup failed for owner {}: {}", owner, e.getMessage());
            return BackupResult.failed(e.getMessage());
        } catch (Exception e) {
            log.error("[Backup] Backup failed for owner {}: {}", owner, e.getMessage(), e);
            return BackupResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            deleteStagingFile(staging);
            ownersInFlight.remove(owner);
        }
    }

    /**
     * List an owner's backups, newest first. Backend failures yield an empty list.
     */
    public List<BackupRecord> listBackups(String ownerId) {
        try {
            return storageBackend.list(ownerId);
        } catch (Exception e) {
            log.error("Error listing {} backups for owner {}: {}", getMode().label(), ownerId, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * Locate and verify a backup, then pass it to the restore handler.
     *
     * @return true if the archive was found, verified and handed over; never throws
     */
    public boolean restoreBackup(String ownerId, String backupId) {
        try (ResolvedArchive archive = storageBackend.resolve(ownerId, backupId)) {
            ArchiveEntryInfo entry = archiveBuilder.inspect(archive.getPath());
            log.info("[Restore] Resolved backup {} for owner {} ({} bytes uncompressed)",
                    backupId, ownerId, entry.uncompressedSize());
            restoreHandler.restore(ownerId, archive.getPath(), entry);
            return true;
        } catch (BackupNotFoundException | IllegalArgumentException e) {
            log.warn("[Restore] Restore failed for owner {}: {}", ownerId, e.getMessage());
            return false;
        } catch (Exception e) {
            log.error("[Restore] Restore of {} failed for owner {}: {}", backupId, ownerId, e.getMessage(), e);
            return false;
        }
    }

    public StorageUsage getStorageUsage(String ownerId) {
        long used = storageUsageTracker.getStorageUsage(OwnerNamespace.requireOwnerId(ownerId));
        return StorageUsage.of(used, storageLimitBytes, getMode());
    }

    @Async("backupExecutor")
    public CompletableFuture<BackupResult> createBackupAsync(String ownerId) {
        return CompletableFuture.completedFuture(createBackup(ownerId));
    }

    @Async("backupExecutor")
    public CompletableFuture<List<BackupRecord>> listBackupsAsync(String ownerId) {
        return CompletableFuture.completedFuture(listBackups(ownerId));
    }

    @Async("backupExecutor")
    public CompletableFuture<Boolean> restoreBackupAsync(String ownerId, String backupId) {
        return CompletableFuture.completedFuture(restoreBackup(ownerId, backupId));
    }

    private Path stagingFile(String owner) {
        try {
            Path ownerStaging = Files.createDirectories(Path.of(stagingDir).resolve(owner));
            return ownerStaging.resolve(ArchiveBuilder.archiveFileName(clock.instant()));
        } catch (IOException e) {
            throw new BackupIOException("Failed to prepare staging directory: " + e.getMessage(), e);
        }
    }

    private long archiveSize(Path archive) {
        try {
            return Files.size(archive);
        } catch (IOException e) {
            throw new BackupIOException("Failed to read archive size: " + e.getMessage(), e);
        }
    }

    private void deleteStagingFile(Path staging) {
        if (staging == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(staging)) {
                log.debug("Removed staging file {}", staging);
            }
        } catch (IOException e) {
            log.warn("Failed to remove staging file {}: {}", staging, e.getMessage());
        }
    }
}
