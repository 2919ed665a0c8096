package com.bikerly.util;

import javax.annotation.Nonnull;

/**
 * Null-safe string helpers for values taken from request headers.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * Returns the value, or "unknown" if it is null or blank.
     */
    @Nonnull
    public static String safe(String value) {
        return safe(value, "unknown");
    }

    /**
     * Returns the value, or the given default if it is null or blank.
     */
    @Nonnull
    public static String safe(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue != null ? defaultValue : "unknown";
        }
        return value;
    }

    /**
     * Returns at most the first {@code maxLength} characters of the value; null becomes "".
     */
    @Nonnull
    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
