package com.ledgerbook.backup.storage;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for S3-compatible object storage, as read from configuration.
 * Blank values mean "not configured".
 */
public record RemoteStorageSettings(
        String endpoint,
        String accessKey,
        String secretKey,
        String region,
        String bucket,
        long maxObjectSizeBytes,
        Duration timeout
) {

    public boolean isComplete() {
        return hasText(endpoint) && hasText(accessKey) && hasText(secretKey);
    }

    public boolean isPartiallyConfigured() {
        return !isComplete() && (hasText(endpoint) || hasText(accessKey) || hasText(secretKey));
    }

    /**
     * True when the endpoint carries an http(s) scheme and parses as an absolute URI with a host.
     */
    public boolean hasValidEndpoint() {
        if (!hasText(endpoint)) {
            return false;
        }
        String trimmed = endpoint.trim();
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            return false;
        }
        try {
            URI uri = URI.create(trimmed);
            return uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
