package in.dhanstream.util;

/**
 * Environment lookups with a system-property fallback, so tests and embedded callers can
 * override a variable with {@code -DNAME=value}.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Mask a secret for logging: keeps the first four characters.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) return "<none>";
        if (secret.length() <= 4) return "****";
        return secret.substring(0, 4) + "****";
    }

    private Env() {}
}
