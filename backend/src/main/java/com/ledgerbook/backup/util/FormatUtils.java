package com.ledgerbook.backup.util;

import java.util.Locale;

/**
 * Display formatting for backup sizes and usage figures.
 */
public final class FormatUtils {

    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FormatUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Format a byte count using binary units, e.g. {@code 1536 -> "1.50 KB"}.
     * Zero and negative counts render as {@code "0 B"}.
     */
    public static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unitIndex = 0;
        double size = bytes;
        while (size >= 1024 && unitIndex < BYTE_UNITS.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, BYTE_UNITS[unitIndex]);
    }

    /**
     * Format a percentage with one decimal place, clamped to 0..100, e.g. {@code "42.5%"}.
     */
    public static String formatPercentage(double percentage) {
        double clamped = Math.max(0.0, Math.min(100.0, percentage));
        return String.format(Locale.ROOT, "%.1f%%", clamped);
    }
}
