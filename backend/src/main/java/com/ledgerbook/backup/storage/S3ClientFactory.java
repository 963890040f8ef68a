package com.ledgerbook.backup.storage;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

/**
 * Builds the S3 client for a set of remote storage settings.
 */
@FunctionalInterface
public interface S3ClientFactory {

    S3Client create(RemoteStorageSettings settings);

    /**
     * Path-style client with static credentials and a bounded API call timeout,
     * suitable for Supabase, MinIO, Hetzner and other S3-compatible endpoints.
     */
    static S3ClientFactory standard() {
        return settings -> S3Client.builder()
                .endpointOverride(URI.create(settings.endpoint().trim()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(settings.accessKey(), settings.secretKey())))
                .region(Region.of(settings.region()))
                .forcePathStyle(true)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(settings.timeout())
                        .apiCallAttemptTimeout(settings.timeout())
                        .build())
                .build();
    }
}
