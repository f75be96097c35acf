package io.autotrade.util;

import java.time.Duration;

/**
 * Environment variable utilities. System properties are consulted when the
 * variable is unset, so tests can override values with -D.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * ISO-8601 duration such as {@code PT30S} or {@code P7D}.
     */
    public static Duration getDuration(String key, Duration defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Duration.parse(value.trim());
        } catch (java.time.format.DateTimeParseException e) {
            return defaultValue;
        }
    }

    private Env() {}
}
