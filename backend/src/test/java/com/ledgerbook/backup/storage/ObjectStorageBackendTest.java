package com.ledgerbook.backup.storage;

import com.ledgerbook.backup.exception.BackendProvisioningException;
import com.ledgerbook.backup.exception.BackendTransferException;
import com.ledgerbook.backup.exception.BackupNotFoundException;
import com.ledgerbook.backup.model.BackupRecord;
import com.ledgerbook.backup.model.DeploymentMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketCannedACL;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.CreateBucketResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ObjectStorageBackend")
@ExtendWith(MockitoExtension.class)
class ObjectStorageBackendTest {

    private static final String BUCKET = "ledger-backups";

    @Mock
    private S3Client s3Client;

    @TempDir
    Path tempDir;

    private Path staging;
    private ObjectStorageBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        staging = Files.createDirectories(tempDir.resolve("staging"));
        backend = new ObjectStorageBackend(s3Client, BUCKET,
                ContainerPolicy.privateArchives(ContainerPolicy.DEFAULT_MAX_OBJECT_SIZE_BYTES), staging);
    }

    @Test
    @DisplayName("should report cloud mode")
    void shouldReportCloudMode() {
        assertThat(backend.mode()).isEqualTo(DeploymentMode.CLOUD);
    }

    @Nested
    @DisplayName("ensureContainer")
    class EnsureContainer {

        @Test
        @DisplayName("should not create an existing bucket")
        void shouldNotCreateExistingBucket() {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());

            backend.ensureContainer(BUCKET);

            verify(s3Client, never()).createBucket(any(CreateBucketRequest.class));
        }

        @Test
        @DisplayName("should create a private bucket when not found")
        void shouldCreateMissingBucket() {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(noSuchBucket());
            when(s3Client.createBucket(any(CreateBucketRequest.class))).thenReturn(CreateBucketResponse.builder().build());

            backend.ensureContainer(BUCKET);

            ArgumentCaptor<CreateBucketRequest> captor = ArgumentCaptor.forClass(CreateBucketRequest.class);
            verify(s3Client).createBucket(captor.capture());
            assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
            assertThat(captor.getValue().acl()).isEqualTo(BucketCannedACL.PRIVATE);
        }

        @Test
        @DisplayName("should treat a plain 404 as not found")
        void shouldCreateOnPlain404() {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(s3Error(404, "Not Found"));
            when(s3Client.createBucket(any(CreateBucketRequest.class))).thenReturn(CreateBucketResponse.builder().build());

            backend.ensureContainer(BUCKET);

            verify(s3Client).createBucket(any(CreateBucketRequest.class));
        }

        @Test
        @DisplayName("should be a no-op on the second call")
        void shouldBeIdempotent() {
            when(s3Client.headBucket(any(HeadBucketRequest.class)))
                    .thenThrow(noSuchBucket())
                    .thenReturn(HeadBucketResponse.builder().build());
            when(s3Client.createBucket(any(CreateBucketRequest.class))).thenReturn(CreateBucketResponse.builder().build());

            backend.ensureContainer(BUCKET);
            assertThatNoException().isThrownBy(() -> backend.ensureContainer(BUCKET));

            verify(s3Client, times(1)).createBucket(any(CreateBucketRequest.class));
        }

        @Test
        @DisplayName("should propagate errors other than not found")
        void shouldPropagateCheckErrors() {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(s3Error(403, "Access Denied"));

            assertThatThrownBy(() -> backend.ensureContainer(BUCKET))
                    .isInstanceOf(BackendProvisioningException.class)
                    .hasMessageContaining("Access Denied");
            verify(s3Client, never()).createBucket(any(CreateBucketRequest.class));
        }

        @Test
        @DisplayName("should fail when creation fails after not found")
        void shouldFailWhenCreationFails() {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(noSuchBucket());
            when(s3Client.createBucket(any(CreateBucketRequest.class))).thenThrow(s3Error(403, "Forbidden"));

            assertThatThrownBy(() -> backend.ensureContainer(BUCKET))
                    .isInstanceOf(BackendProvisioningException.class)
                    .hasMessageContaining("auto-creation failed");
        }
    }

    @Nested
    @DisplayName("put")
    class Put {

        @Test
        @DisplayName("should upload under the owner prefix and remove the staging file")
        void shouldUploadAndRemoveStaging() throws IOException {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());
            when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                    .thenReturn(PutObjectResponse.builder().build());
            Path archive = Files.writeString(staging.resolve("backup_2025-01-01T00-00-00_GMT.zip"), "zip-bytes");

            StoredBackup stored = backend.put("owner-1", archive);

            ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
            verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
            assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
            assertThat(captor.getValue().key()).isEqualTo("owner-1/backup_2025-01-01T00-00-00_GMT.zip");
            assertThat(captor.getValue().contentType()).isEqualTo("application/zip");
            assertThat(stored.storedId()).isEqualTo("backup_2025-01-01T00-00-00_GMT.zip");
            assertThat(stored.sizeBytes()).isEqualTo(9);
            assertThat(archive).doesNotExist();
        }

        @Test
        @DisplayName("should reject archives above the size limit before uploading")
        void shouldRejectOversizedArchive() throws IOException {
            ObjectStorageBackend small = new ObjectStorageBackend(s3Client, BUCKET,
                    ContainerPolicy.privateArchives(4), staging);
            Path archive = Files.writeString(staging.resolve("backup_2025-01-01T00-00-00_GMT.zip"), "too large");

            assertThatThrownBy(() -> small.put("owner-1", archive))
                    .isInstanceOf(BackendTransferException.class)
                    .hasMessageContaining("limit");
            verifyNoInteractions(s3Client);
        }

        @Test
        @DisplayName("should surface upload failures as transfer errors")
        void shouldWrapUploadFailure() throws IOException {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());
            when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                    .thenThrow(ApiCallTimeoutException.create(60_000));
            Path archive = Files.writeString(staging.resolve("backup_2025-01-01T00-00-00_GMT.zip"), "zip-bytes");

            assertThatThrownBy(() -> backend.put("owner-1", archive))
                    .isInstanceOf(BackendTransferException.class)
                    .hasMessageContaining("owner-1/backup_2025-01-01T00-00-00_GMT.zip");
        }

        @Test
        @DisplayName("should not upload when provisioning fails")
        void shouldNotUploadWhenProvisioningFails() throws IOException {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(s3Error(500, "Internal Error"));
            Path archive = Files.writeString(staging.resolve("backup_2025-01-01T00-00-00_GMT.zip"), "zip-bytes");

            assertThatThrownBy(() -> backend.put("owner-1", archive))
                    .isInstanceOf(BackendProvisioningException.class);
            verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
        }
    }

    @Nested
    @DisplayName("list")
    class ListBackups {

        @Test
        @DisplayName("should list owner objects newest first")
        void shouldListNewestFirst() {
            when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                    .contents(
                            object("owner-1/backup_2025-01-01T00-00-00_GMT.zip", 10L, "2025-01-01T00:00:00Z"),
                            object("owner-1/backup_2025-01-03T00-00-00_GMT.zip", 30L, "2025-01-03T00:00:00Z"),
                            object("owner-1/backup_2025-01-02T00-00-00_GMT.zip", 20L, "2025-01-02T00:00:00Z"))
                    .isTruncated(false)
                    .build());

            List<BackupRecord> records = backend.list("owner-1");

            assertThat(records).extracting(BackupRecord::getId).containsExactly(
                    "backup_2025-01-03T00-00-00_GMT.zip",
                    "backup_2025-01-02T00-00-00_GMT.zip",
                    "backup_2025-01-01T00-00-00_GMT.zip");
            assertThat(records).extracting(BackupRecord::getSizeBytes).containsExactly(30L, 20L, 10L);

            ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
            verify(s3Client).listObjectsV2(captor.capture());
            assertThat(captor.getValue().prefix()).isEqualTo("owner-1/");
            assertThat(captor.getValue().maxKeys()).isEqualTo(100);
        }

        @Test
        @DisplayName("should default missing sizes to zero and skip nested keys")
        void shouldDefaultSizeAndSkipNested() {
            when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                    .contents(
                            object("owner-1/backup_2025-01-01T00-00-00_GMT.zip", null, "2025-01-01T00:00:00Z"),
                            object("owner-1/", 0L, "2025-01-01T00:00:00Z"),
                            object("owner-1/nested/backup.zip", 5L, "2025-01-01T00:00:00Z"))
                    .isTruncated(false)
                    .build());

            List<BackupRecord> records = backend.list("owner-1");

            assertThat(records).hasSize(1);
            assertThat(records.get(0).getSizeBytes()).isZero();
        }

        @Test
        @DisplayName("should follow continuation tokens")
        void shouldFollowPages() {
            when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                    .thenReturn(ListObjectsV2Response.builder()
                            .contents(object("owner-1/backup_2025-01-01T00-00-00_GMT.zip", 1L, "2025-01-01T00:00:00Z"))
                            .isTruncated(true)
                            .nextContinuationToken("page-2")
                            .build())
                    .thenReturn(ListObjectsV2Response.builder()
                            .contents(object("owner-1/backup_2025-01-02T00-00-00_GMT.zip", 2L, "2025-01-02T00:00:00Z"))
                            .isTruncated(false)
                            .build());

            List<BackupRecord> records = backend.list("owner-1");

            assertThat(records).extracting(BackupRecord::getId).containsExactly(
                    "backup_2025-01-02T00-00-00_GMT.zip",
                    "backup_2025-01-01T00-00-00_GMT.zip");
            ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
            verify(s3Client, times(2)).listObjectsV2(captor.capture());
            assertThat(captor.getAllValues().get(1).continuationToken()).isEqualTo("page-2");
        }

        @Test
        @DisplayName("should return empty list before the bucket exists")
        void shouldReturnEmptyWithoutBucket() {
            when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenThrow(noSuchBucket());

            assertThat(backend.list("owner-1")).isEmpty();
        }

        @Test
        @DisplayName("should surface other listing errors")
        void shouldWrapListingErrors() {
            when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenThrow(s3Error(500, "Internal Error"));

            assertThatThrownBy(() -> backend.list("owner-1"))
                    .isInstanceOf(BackendTransferException.class);
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("should download into a temporary file removed on close")
        void shouldDownloadToTemporaryFile() throws IOException {
            byte[] content = "zip-bytes".getBytes();
            when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                    .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content));

            Path downloaded;
            try (ResolvedArchive archive = backend.resolve("owner-1", "backup_2025-01-01T00-00-00_GMT.zip")) {
                downloaded = archive.getPath();
                assertThat(archive.isTemporary()).isTrue();
                assertThat(Files.readAllBytes(downloaded)).isEqualTo(content);
            }
            assertThat(downloaded).doesNotExist();

            ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
            verify(s3Client).getObjectAsBytes(captor.capture());
            assertThat(captor.getValue().key()).isEqualTo("owner-1/backup_2025-01-01T00-00-00_GMT.zip");
        }

        @Test
        @DisplayName("should throw not found for a missing key")
        void shouldThrowNotFound() {
            when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                    .thenThrow(NoSuchKeyException.builder().statusCode(404).message("The specified key does not exist.").build());

            assertThatThrownBy(() -> backend.resolve("owner-1", "nonexistent"))
                    .isInstanceOf(BackupNotFoundException.class);
        }

        @Test
        @DisplayName("should surface download failures as transfer errors")
        void shouldWrapDownloadFailure() {
            when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(s3Error(503, "Slow Down"));

            assertThatThrownBy(() -> backend.resolve("owner-1", "backup_2025-01-01T00-00-00_GMT.zip"))
                    .isInstanceOf(BackendTransferException.class);
        }

        @Test
        @DisplayName("should reject backup ids with path segments")
        void shouldRejectTraversal() {
            assertThatThrownBy(() -> backend.resolve("owner-1", "../owner-2/backup.zip"))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(s3Client);
        }
    }

    private static S3Object object(String key, Long size, String lastModified) {
        return S3Object.builder()
                .key(key)
                .size(size)
                .lastModified(Instant.parse(lastModified))
                .build();
    }

    private static NoSuchBucketException noSuchBucket() {
        return NoSuchBucketException.builder().statusCode(404).message("The specified bucket does not exist").build();
    }

    private static S3Exception s3Error(int status, String message) {
        return (S3Exception) S3Exception.builder().statusCode(status).message(message).build();
    }
}
