package com.ledgerbook.backup.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Path;

/**
 * Picks the storage backend once at startup. Remote storage is used only when
 * the endpoint and both keys are present, the endpoint is an http(s) URL and the
 * client can be built; anything else falls back to local disk.
 */
@Slf4j
@RequiredArgsConstructor
public class StorageModeResolver {

    private final S3ClientFactory clientFactory;

    public BackendResolution resolve(RemoteStorageSettings remote, Path localRoot, Path stagingDir) {
        if (!remote.isComplete()) {
            if (remote.isPartiallyConfigured()) {
                String error = "Remote storage configuration incomplete (endpoint, access key and secret key are all required)";
                log.warn("{} - using local backup storage at {}", error, localRoot);
                return BackendResolution.local(new LocalStorageBackend(localRoot), error);
            }
            log.info("Remote storage not configured - using local backup storage at {}", localRoot);
            return BackendResolution.local(new LocalStorageBackend(localRoot), null);
        }

        if (!remote.hasValidEndpoint()) {
            String error = "Remote storage endpoint is not a valid http(s) URL: " + remote.endpoint();
            log.warn("{} - using local backup storage at {}", error, localRoot);
            return BackendResolution.local(new LocalStorageBackend(localRoot), error);
        }

        try {
            S3Client client = clientFactory.create(remote);
            ContainerPolicy policy = ContainerPolicy.privateArchives(remote.maxObjectSizeBytes());
            log.info("Remote backup storage initialized with endpoint: {}, bucket: {}", remote.endpoint(), remote.bucket());
            return BackendResolution.cloud(new ObjectStorageBackend(client, remote.bucket(), policy, stagingDir));
        } catch (RuntimeException e) {
            String error = "Failed to initialize remote storage client: " + e.getMessage();
            log.error("{} - using local backup storage at {}", error, localRoot, e);
            return BackendResolution.local(new LocalStorageBackend(localRoot), error);
        }
    }
}
