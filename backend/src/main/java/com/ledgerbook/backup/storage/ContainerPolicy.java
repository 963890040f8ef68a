package com.ledgerbook.backup.storage;

import com.ledgerbook.backup.exception.BackendTransferException;

import java.util.List;

/**
 * Fixed policy for the remote backup container: applied when the bucket is
 * created and checked before every upload.
 */
public record ContainerPolicy(boolean publicAccess, long maxObjectSizeBytes, List<String> allowedContentTypes) {

    public static final String ARCHIVE_CONTENT_TYPE = "application/zip";
    public static final long DEFAULT_MAX_OBJECT_SIZE_BYTES = 50L * 1024 * 1024;

    public static ContainerPolicy privateArchives(long maxObjectSizeBytes) {
        return new ContainerPolicy(false, maxObjectSizeBytes, List.of(ARCHIVE_CONTENT_TYPE));
    }

    public void checkUpload(String key, long sizeBytes, String contentType) {
        if (sizeBytes > maxObjectSizeBytes) {
            throw new BackendTransferException(String.format(
                    "Backup %s is %d bytes, above the %d byte limit of the backup bucket",
                    key, sizeBytes, maxObjectSizeBytes));
        }
        if (!allowedContentTypes.contains(contentType)) {
            throw new BackendTransferException("Content type " + contentType + " is not allowed in the backup bucket");
        }
    }
}
