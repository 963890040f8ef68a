package com.ledgerbook.backup.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class SourceMissingException extends BackupException {

    private final Path sourcePath;

    public SourceMissingException(Path sourcePath) {
        super("Database file (" + sourcePath.getFileName() + ") not found");
        this.sourcePath = sourcePath;
    }
}
