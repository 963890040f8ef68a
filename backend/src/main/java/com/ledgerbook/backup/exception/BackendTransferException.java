package com.ledgerbook.backup.exception;

public class BackendTransferException extends BackupException {

    public BackendTransferException(String message) {
        super(message);
    }

    public BackendTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
