package org.foxesworld.zimbridge.engine.writer;

import java.util.Locale;

/** Per-entry hints understood by the engine. */
public enum Hint {
    COMPRESS,
    FRONT_ARTICLE;

    public int flag() {
        return 1 << ordinal();
    }

    /** @return the hint with that name (case-insensitive), or null if there is none */
    public static Hint fromName(String name) {
        if (name == null) return null;
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (Hint h : values()) {
            if (h.name().equals(n)) return h;
        }
        return null;
    }
}
