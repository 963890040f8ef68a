package com.ledgerbook.backup.exception;

/**
 * Disk or stream failure while building, moving or reading an archive.
 */
public class BackupIOException extends BackupException {

    public BackupIOException(String message) {
        super(message);
    }

    public BackupIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
