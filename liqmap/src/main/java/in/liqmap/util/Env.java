package in.liqmap.util;

/**
 * Environment variable utilities.
 *
 * Values are read from the environment first, then from system properties.
 */
public final class Env {

    public static final String CONFIG_DIR = "LIQMAP_CONFIG_DIR";
    public static final String STATS_PORT = "LIQMAP_STATS_PORT";
    public static final String BACKFILL_THREADS = "LIQMAP_BACKFILL_THREADS";
    public static final String WINDOW_SIZE = "LIQMAP_WINDOW_SIZE";
    public static final String STATS_ENABLED = "LIQMAP_STATS_ENABLED";

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
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    public static String configDir() {
        return get(CONFIG_DIR, "./config");
    }

    public static int statsPort() {
        return getInt(STATS_PORT, 9191);
    }

    public static int backfillThreads() {
        return getInt(BACKFILL_THREADS, 2);
    }

    public static int windowSize() {
        return getInt(WINDOW_SIZE, 500);
    }

    public static boolean statsEnabled() {
        return getBool(STATS_ENABLED, true);
    }

    private Env() {}
}
