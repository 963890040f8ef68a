package com.ledgerbook.backup.storage;

import com.ledgerbook.backup.model.DeploymentMode;

import java.util.Optional;

/**
 * The backend chosen at startup, plus the reason remote storage was rejected
 * when it was configured but could not be used.
 */
public record BackendResolution(StorageBackend backend, String configError) {

    public static BackendResolution cloud(StorageBackend backend) {
        return new BackendResolution(backend, null);
    }

    public static BackendResolution local(StorageBackend backend, String configError) {
        return new BackendResolution(backend, configError);
    }

    public DeploymentMode mode() {
        return backend.mode();
    }

    public Optional<String> configErrorMessage() {
        return Optional.ofNullable(configError);
    }
}
