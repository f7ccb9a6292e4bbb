package in.linker.util;

import java.time.Duration;

/**
 * Environment variable utilities.
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

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Duration expressed in milliseconds.
     */
    public static Duration getMillis(String key, Duration defaultValue) {
        long millis = getLong(key, -1L);
        return millis < 0 ? defaultValue : Duration.ofMillis(millis);
    }

    /**
     * Duration expressed in seconds.
     */
    public static Duration getSeconds(String key, Duration defaultValue) {
        long seconds = getLong(key, -1L);
        return seconds < 0 ? defaultValue : Duration.ofSeconds(seconds);
    }

    private Env() {}
}
