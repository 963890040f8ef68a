package com.ledgerbook.backup.storage;

import java.util.regex.Pattern;

/**
 * Builds and validates the per-owner path/key prefix that isolates tenants.
 */
public final class OwnerNamespace {

    private static final Pattern SEGMENT = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,254}$");

    private OwnerNamespace() {
        // Utility class - prevent instantiation
    }

    public static String requireOwnerId(String ownerId) {
        return requireSegment(ownerId, "owner id");
    }

    public static String requireStoredId(String storedId) {
        return requireSegment(storedId, "backup id");
    }

    /**
     * Key prefix for everything an owner stores remotely, including the trailing slash.
     */
    public static String prefix(String ownerId) {
        return requireOwnerId(ownerId) + "/";
    }

    public static String objectKey(String ownerId, String storedId) {
        return prefix(ownerId) + requireStoredId(storedId);
    }

    private static String requireSegment(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + what);
        }
        if (value.contains("..") || !SEGMENT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value);
        }
        return value;
    }
}
