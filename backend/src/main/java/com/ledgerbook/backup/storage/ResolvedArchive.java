package com.ledgerbook.backup.storage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A backup archive made available as a local file for restore.
 * Temporary copies (downloads) are deleted on close; archives already on
 * local disk are left untouched.
 */
@Slf4j
@Getter
public class ResolvedArchive implements Closeable {

    private final Path path;
    private final boolean temporary;

    private ResolvedArchive(Path path, boolean temporary) {
        this.path = path;
        this.temporary = temporary;
    }

    public static ResolvedArchive inPlace(Path path) {
        return new ResolvedArchive(path, false);
    }

    public static ResolvedArchive temporary(Path path) {
        return new ResolvedArchive(path, true);
    }

    @Override
    public void close() throws IOException {
        if (temporary && Files.deleteIfExists(path)) {
            log.debug("Removed temporary restore download {}", path);
        }
    }
}
