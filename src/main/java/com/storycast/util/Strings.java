package com.storycast.util;

import javax.annotation.Nonnull;

/**
 * Null-safe string helpers for @Nonnull APIs and log output.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * @return the value, or "unknown" when it is null or blank
     */
    @Nonnull
    public static String safe(String value) {
        return safe(value, "unknown");
    }

    /**
     * @return the value, or {@code defaultValue} ("unknown" if that is null too) when it is null or blank
     */
    @Nonnull
    public static String safe(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue != null ? defaultValue : "unknown";
        }
        return value;
    }

    /**
     * Shortens text for log previews, appending "..." when cut.
     *
     * @param value    text to shorten, may be null
     * @param maxChars maximum length of the returned preview, excluding the ellipsis
     */
    @Nonnull
    public static String abbreviate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, Math.max(0, maxChars)) + "...";
    }
}
