package org.foxesworld.zimbridge.engine.writer;

import java.util.Locale;

/** Cluster compression selector. */
public enum Compression {
    NONE,
    LZMA,
    ZSTD;

    private static final Compression[] VALUES = values();

    /** Unknown ordinals map to {@link #NONE}. */
    public static Compression fromOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= VALUES.length) return NONE;
        return VALUES[ordinal];
    }

    public static Compression fromName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Compression name is blank");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown compression: " + name, e);
        }
    }
}
