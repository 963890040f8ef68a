package com.ledgerbook.backup.config;

import com.ledgerbook.backup.storage.BackendResolution;
import com.ledgerbook.backup.storage.S3ClientFactory;
import com.ledgerbook.backup.storage.StorageBackend;
import com.ledgerbook.backup.storage.StorageModeResolver;
import com.ledgerbook.backup.storage.RemoteStorageSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Resolves the backup storage backend once at startup from the {@code s3.*}
 * and {@code backup.*} properties.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Value("${s3.endpoint:}")
    private String endpoint;

    @Value("${s3.access-key:}")
    private String accessKey;

    @Value("${s3.secret-key:}")
    private String secretKey;

    @Value("${s3.region:us-east-1}")
    private String region;

    @Value("${s3.bucket:ledger-backups}")
    private String bucket;

    @Value("${s3.max-object-size-bytes:52428800}")
    private long maxObjectSizeBytes;

    @Value("${s3.timeout-seconds:60}")
    private long timeoutSeconds;

    @Value("${backup.local-root:backups}")
    private String localRoot;

    @Value("${backup.staging-dir:${java.io.tmpdir}/ledger-backup-staging}")
    private String stagingDir;

    @Bean
    public S3ClientFactory s3ClientFactory() {
        return S3ClientFactory.standard();
    }

    @Bean
    public BackendResolution backendResolution(S3ClientFactory s3ClientFactory) {
        RemoteStorageSettings remote = new RemoteStorageSettings(endpoint, accessKey, secretKey, region, bucket,
                maxObjectSizeBytes, Duration.ofSeconds(timeoutSeconds));

        BackendResolution resolution = new StorageModeResolver(s3ClientFactory)
                .resolve(remote, Path.of(localRoot), Path.of(stagingDir));

        resolution.configErrorMessage().ifPresent(error ->
                log.warn("Remote backup storage is misconfigured, backups are kept on local disk: {}", error));
        log.info("Backup storage mode: {}", resolution.mode().label());
        return resolution;
    }

    @Bean
    public StorageBackend storageBackend(BackendResolution backendResolution) {
        return backendResolution.backend();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
