package com.ledgerbook.backup.exception;

import lombok.Getter;

/**
 * The remote container could not be checked or created.
 * Signals misconfigured remote storage rather than a single failed backup.
 */
@Getter
public class BackendProvisioningException extends BackupException {

    private final String container;

    public BackendProvisioningException(String container, String message, Throwable cause) {
        super(message, cause);
        this.container = container;
    }
}
