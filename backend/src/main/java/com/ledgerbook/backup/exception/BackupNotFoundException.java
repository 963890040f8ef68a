package com.ledgerbook.backup.exception;

import lombok.Getter;

@Getter
public class BackupNotFoundException extends BackupException {

    private final String ownerId;
    private final String backupId;

    public BackupNotFoundException(String ownerId, String backupId) {
        super("Backup not found: " + backupId);
        this.ownerId = ownerId;
        this.backupId = backupId;
    }
}
