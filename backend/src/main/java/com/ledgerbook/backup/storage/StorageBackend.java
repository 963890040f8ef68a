package com.ledgerbook.backup.storage;

import com.ledgerbook.backup.model.BackupRecord;
import com.ledgerbook.backup.model.DeploymentMode;

import java.nio.file.Path;
import java.util.List;

/**
 * Storage medium for backup archives. Every operation is scoped to a single
 * owner's namespace; implementations must never read or enumerate another
 * owner's archives.
 */
public interface StorageBackend {

    DeploymentMode mode();

    /**
     * Persist a staged archive under the owner's namespace, keeping its file name.
     * The staging file no longer exists once this returns normally.
     *
     * @param ownerId the tenant the archive belongs to
     * @param archive the staged archive on local disk
     * @return the stored name and the archive size
     */
    StoredBackup put(String ownerId, Path archive);

    /**
     * List the owner's archives, newest first. An owner without backups gets an empty list.
     */
    List<BackupRecord> list(String ownerId);

    /**
     * Make a stored archive available as a local file. Callers must close the result.
     *
     * @throws com.ledgerbook.backup.exception.BackupNotFoundException if no such archive exists for the owner
     */
    ResolvedArchive resolve(String ownerId, String storedId);
}
