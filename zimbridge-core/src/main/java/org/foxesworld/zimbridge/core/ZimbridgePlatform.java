package org.foxesworld.zimbridge.core;

public final class ZimbridgePlatform {
    public static String java() {
        return System.getProperty("java.version");
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    public static int cpus() {
        return Runtime.getRuntime().availableProcessors();
    }

    /** Reads a positive int system property, falling back to {@code def}. */
    public static int intProperty(String key, int def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            int v = Integer.parseInt(raw.trim());
            return v > 0 ? v : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private ZimbridgePlatform() {}
}
