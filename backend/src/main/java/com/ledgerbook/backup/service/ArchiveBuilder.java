package com.ledgerbook.backup.service;

import com.ledgerbook.backup.exception.BackupIOException;
import com.ledgerbook.backup.exception.SourceMissingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Enumeration;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Packs a database file into a single-entry ZIP archive and checks archives
 * before they are handed to a restore.
 */
@Slf4j
@Component
public class ArchiveBuilder {

    public static final String ARCHIVE_EXTENSION = "zip";
    static final String ENTRY_BASE_NAME = "database";
    private static final String DEFAULT_ENTRY_EXTENSION = "db";

    /**
     * Archive file name for a capture time, e.g. {@code backup_2025-03-04T10-15-30_GMT.zip}.
     * Whole-second precision; colons and dots of the ISO-8601 form become dashes.
     */
    public static String archiveFileName(Instant capturedAt) {
        String timestamp = capturedAt.toString().replace(':', '-').replace('.', '-');
        return "backup_" + timestamp.substring(0, 19) + "_GMT." + ARCHIVE_EXTENSION;
    }

    /**
     * Name of the entry holding the database, keeping the source file's extension.
     */
    public static String entryName(Path source) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String extension = dot > 0 && dot < fileName.length() - 1
                ? fileName.substring(dot + 1)
                : DEFAULT_ENTRY_EXTENSION;
        return ENTRY_BASE_NAME + "." + extension;
    }

    /**
     * Write {@code source} into a new archive at {@code destination}.
     * The source is only read. A partially written destination is removed on failure.
     *
     * @throws SourceMissingException if the source does not exist
     * @throws BackupIOException if reading or writing fails
     */
    public void build(Path source, Path destination) {
        if (!Files.isRegularFile(source)) {
            throw new SourceMissingException(source);
        }

        String entryName = entryName(source);
        try (InputStream in = Files.newInputStream(source);
             ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(destination)))) {
            zip.setLevel(Deflater.BEST_COMPRESSION);

            ZipEntry entry = new ZipEntry(entryName);
            entry.setTime(Files.getLastModifiedTime(source).toMillis());
            zip.putNextEntry(entry);
            long copied = in.transferTo(zip);
            zip.closeEntry();

            log.debug("Archived {} bytes from {} into {} as {}", copied, source, destination, entryName);
        } catch (NoSuchFileException e) {
            deletePartial(destination);
            if (e.getFile() != null && Path.of(e.getFile()).equals(source)) {
                throw new SourceMissingException(source);
            }
            throw new BackupIOException("Failed to create archive " + destination + ": " + e.getMessage(), e);
        } catch (IOException e) {
            deletePartial(destination);
            throw new BackupIOException("Failed to create archive " + destination + ": " + e.getMessage(), e);
        }
    }

    /**
     * Check that an archive holds exactly one database entry and report it.
     *
     * @throws BackupIOException if the file is not a readable archive of that shape
     */
    public ArchiveEntryInfo inspect(Path archive) {
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            if (!entries.hasMoreElements()) {
                throw new BackupIOException("Backup archive " + archive.getFileName() + " is empty");
            }
            ZipEntry entry = entries.nextElement();
            if (entries.hasMoreElements()) {
                throw new BackupIOException("Backup archive " + archive.getFileName() + " holds more than one entry");
            }
            if (entry.isDirectory() || !entry.getName().startsWith(ENTRY_BASE_NAME + ".")) {
                throw new BackupIOException("Unexpected entry in backup archive: " + entry.getName());
            }
            return new ArchiveEntryInfo(entry.getName(), entry.getSize());
        } catch (IOException e) {
            throw new BackupIOException("Unreadable backup archive " + archive.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private void deletePartial(Path destination) {
        try {
            Files.deleteIfExists(destination);
        } catch (IOException e) {
            log.warn("Could not remove partial archive {}: {}", destination, e.getMessage());
        }
    }
}
