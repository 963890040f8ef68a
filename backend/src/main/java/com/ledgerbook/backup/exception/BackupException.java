package com.ledgerbook.backup.exception;

/**
 * Base type for failures inside the backup subsystem.
 * These never cross the public {@code BackupService} boundary; they are
 * converted into result values there.
 */
public abstract class BackupException extends RuntimeException {

    protected BackupException(String message) {
        super(message);
    }

    protected BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
