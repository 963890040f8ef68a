package com.ledgerbook.backup.storage;

import com.ledgerbook.backup.exception.BackupIOException;
import com.ledgerbook.backup.exception.BackupNotFoundException;
import com.ledgerbook.backup.model.BackupRecord;
import com.ledgerbook.backup.model.DeploymentMode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Keeps backup archives on local disk under {@code <root>/<ownerId>/<file>}.
 * Used when no remote object storage is configured.
 */
@Slf4j
public class LocalStorageBackend implements StorageBackend {

    @Getter
    private final Path root;

    public LocalStorageBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public DeploymentMode mode() {
        return DeploymentMode.LOCAL;
    }

    @Override
    public StoredBackup put(String ownerId, Path archive) {
        Path ownerDir = ownerDirectory(ownerId);
        String fileName = OwnerNamespace.requireStoredId(archive.getFileName().toString());

        try {
            Files.createDirectories(ownerDir);
            long size = Files.size(archive);
            Path target = ownerDir.resolve(fileName);
            move(archive, target);
            log.info("Local backup saved: {} ({} bytes)", target, size);
            return new StoredBackup(fileName, size);
        } catch (IOException e) {
            throw new BackupIOException("Failed to store backup locally: " + e.getMessage(), e);
        }
    }

    @Override
    public List<BackupRecord> list(String ownerId) {
        Path ownerDir = ownerDirectory(ownerId);
        if (!Files.isDirectory(ownerDir)) {
            return List.of();
        }

        List<BackupRecord> records = new ArrayList<>();
        try (Stream<Path> files = Files.list(ownerDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                String name = file.getFileName().toString();
                records.add(BackupRecord.builder()
                        .id(name)
                        .displayName(name)
                        .sizeBytes(attrs.size())
                        .createdAt(attrs.creationTime().toInstant())
                        .build());
            }
        } catch (IOException e) {
            throw new BackupIOException("Failed to list local backups: " + e.getMessage(), e);
        }

        records.sort(BackupRecord.NEWEST_FIRST);
        return records;
    }

    @Override
    public ResolvedArchive resolve(String ownerId, String storedId) {
        Path ownerDir = ownerDirectory(ownerId);
        Path file = ownerDir.resolve(OwnerNamespace.requireStoredId(storedId)).normalize();
        if (!file.getParent().equals(ownerDir)) {
            throw new IllegalArgumentException("Invalid backup id: " + storedId);
        }

        if (!Files.isDirectory(ownerDir) || !Files.isRegularFile(file)) {
            throw new BackupNotFoundException(ownerId, storedId);
        }
        return ResolvedArchive.inPlace(file);
    }

    private Path ownerDirectory(String ownerId) {
        Path ownerDir = root.resolve(OwnerNamespace.requireOwnerId(ownerId)).normalize();
        if (!ownerDir.getParent().equals(root)) {
            throw new IllegalArgumentException("Invalid owner id: " + ownerId);
        }
        return ownerDir;
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // Staging dir on another filesystem
            log.debug("Atomic move not supported for {}, falling back to copy-and-delete", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
