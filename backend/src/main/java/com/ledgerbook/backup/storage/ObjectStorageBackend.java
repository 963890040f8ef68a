package com.ledgerbook.backup.storage;

import com.ledgerbook.backup.exception.BackendProvisioningException;
import com.ledgerbook.backup.exception.BackendTransferException;
import com.ledgerbook.backup.exception.BackupIOException;
import com.ledgerbook.backup.exception.BackupNotFoundException;
import com.ledgerbook.backup.model.BackupRecord;
import com.ledgerbook.backup.model.DeploymentMode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.BucketCannedACL;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps backup archives in an S3-compatible bucket under {@code <ownerId>/<file>}.
 * The bucket is created on first use with a private ACL; the size and content
 * type limits of {@link ContainerPolicy} are enforced on upload.
 */
@Slf4j
public class ObjectStorageBackend implements StorageBackend, AutoCloseable {

    static final int LIST_PAGE_SIZE = 100;

    private final S3Client s3Client;
    @Getter
    private final String bucket;
    @Getter
    private final ContainerPolicy policy;
    private final Path stagingDir;

    public ObjectStorageBackend(S3Client s3Client, String bucket, ContainerPolicy policy, Path stagingDir) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.policy = policy;
        this.stagingDir = stagingDir;
    }

    @Override
    public DeploymentMode mode() {
        return DeploymentMode.CLOUD;
    }

    /**
     * Make sure the named bucket exists, creating it when the provider reports it missing.
     * Calling this again once the bucket exists does nothing.
     *
     * @throws BackendProvisioningException if the check fails for another reason or creation fails
     */
    public void ensureContainer(String name) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(name).build());
            log.debug("Bucket '{}' exists", name);
            return;
        } catch (NoSuchBucketException e) {
            log.info("Bucket '{}' not found. Attempting to create it...", name);
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                log.error("Error checking bucket '{}': {}", name, e.getMessage());
                throw new BackendProvisioningException(name,
                        "Failed to check bucket '" + name + "': " + e.getMessage(), e);
            }
            log.info("Bucket '{}' not found. Attempting to create it...", name);
        } catch (SdkException e) {
            log.error("Error checking bucket '{}': {}", name, e.getMessage());
            throw new BackendProvisioningException(name,
                    "Failed to check bucket '" + name + "': " + e.getMessage(), e);
        }

        createContainer(name);
    }

    private void createContainer(String name) {
        try {
            s3Client.createBucket(CreateBucketRequest.builder()
                    .bucket(name)
                    .acl(policy.publicAccess() ? BucketCannedACL.PUBLIC_READ : BucketCannedACL.PRIVATE)
                    .build());
            log.info("Bucket '{}' created successfully (max object size {} bytes, content types {})",
                    name, policy.maxObjectSizeBytes(), policy.allowedContentTypes());
        } catch (BucketAlreadyOwnedByYouException e) {
            log.debug("Bucket '{}' was created concurrently", name);
        } catch (SdkException e) {
            log.error("Failed to create bucket '{}': {}", name, e.getMessage());
            throw new BackendProvisioningException(name, "Bucket '" + name
                    + "' missing and auto-creation failed: " + e.getMessage() + ". Please create it manually.", e);
        }
    }

    @Override
    public StoredBackup put(String ownerId, Path archive) {
        String fileName = OwnerNamespace.requireStoredId(archive.getFileName().toString());
        String key = OwnerNamespace.objectKey(ownerId, fileName);

        byte[] content;
        try {
            policy.checkUpload(key, Files.size(archive), ContainerPolicy.ARCHIVE_CONTENT_TYPE);
            content = Files.readAllBytes(archive);
        } catch (IOException e) {
            throw new BackupIOException("Failed to read staged backup " + archive + ": " + e.getMessage(), e);
        }

        ensureContainer(bucket);

        log.info("Uploading backup to bucket '{}': {}", bucket, key);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(ContainerPolicy.ARCHIVE_CONTENT_TYPE)
                    .contentLength((long) content.length)
                    .build();

            // PutObject replaces an existing object at the same key
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            log.error("Failed to upload backup {}: {}", key, e.getMessage());
            throw new BackendTransferException("Failed to upload backup " + key + ": " + e.getMessage(), e);
        }
        log.info("Upload successful: {} ({} bytes)", key, content.length);

        try {
            Files.deleteIfExists(archive);
        } catch (IOException e) {
            log.warn("Uploaded {} but could not remove staging file {}: {}", key, archive, e.getMessage());
        }
        return new StoredBackup(fileName, content.length);
    }

    @Override
    public List<BackupRecord> list(String ownerId) {
        String prefix = OwnerNamespace.prefix(ownerId);
        List<BackupRecord> records = new ArrayList<>();

        try {
            String continuationToken = null;
            do {
                ListObjectsV2Response page = s3Client.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix)
                        .maxKeys(LIST_PAGE_SIZE)
                        .continuationToken(continuationToken)
                        .build());

                for (S3Object object : page.contents()) {
                    String name = object.key().substring(prefix.length());
                    // Skip the prefix marker itself and anything nested below it
                    if (name.isEmpty() || name.contains("/")) {
                        continue;
                    }
                    records.add(BackupRecord.builder()
                            .id(name)
                            .displayName(name)
                            .sizeBytes(object.size() != null ? object.size() : 0L)
                            .createdAt(object.lastModified())
                            .build());
                }

                continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (continuationToken != null);
        } catch (NoSuchBucketException e) {
            log.debug("Bucket '{}' does not exist yet, no backups for {}", bucket, ownerId);
            return List.of();
        } catch (SdkException e) {
            throw new BackendTransferException("Failed to list backups under " + prefix + ": " + e.getMessage(), e);
        }

        records.sort(BackupRecord.NEWEST_FIRST);
        return records.size() > LIST_PAGE_SIZE ? List.copyOf(records.subList(0, LIST_PAGE_SIZE)) : records;
    }

    @Override
    public ResolvedArchive resolve(String ownerId, String storedId) {
        String key = OwnerNamespace.objectKey(ownerId, storedId);

        byte[] content;
        try {
            content = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build()).asByteArray();
        } catch (NoSuchKeyException | NoSuchBucketException e) {
            log.warn("Backup not found in bucket '{}': {}", bucket, key);
            throw new BackupNotFoundException(ownerId, storedId);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new BackupNotFoundException(ownerId, storedId);
            }
            throw new BackendTransferException("Failed to download backup " + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new BackendTransferException("Failed to download backup " + key + ": " + e.getMessage(), e);
        }

        Path target = null;
        try {
            Path ownerStaging = Files.createDirectories(stagingDir.resolve(ownerId));
            target = Files.createTempFile(ownerStaging, "restore_", ".zip");
            Files.write(target, content);
            log.debug("Downloaded {} ({} bytes) to {}", key, content.length, target);
            return ResolvedArchive.temporary(target);
        } catch (IOException e) {
            BackupIOException failure = new BackupIOException(
                    "Failed to stage downloaded backup " + key + ": " + e.getMessage(), e);
            if (target != null) {
                try {
                    Files.deleteIfExists(target);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    @Override
    public void close() {
        try {
            s3Client.close();
            log.debug("S3 client closed");
        } catch (Exception e) {
            log.warn("Error closing S3 client: {}", e.getMessage());
        }
    }
}
