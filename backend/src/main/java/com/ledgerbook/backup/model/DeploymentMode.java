package com.ledgerbook.backup.model;

/**
 * Where backup archives live for the lifetime of the process.
 */
public enum DeploymentMode {
    CLOUD,
    LOCAL;

    public String label() {
        return name().toLowerCase();
    }
}
