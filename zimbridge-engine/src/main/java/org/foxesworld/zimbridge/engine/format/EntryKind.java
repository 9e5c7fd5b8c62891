package org.foxesworld.zimbridge.engine.format;

public enum EntryKind {
    ITEM,
    REDIRECT,
    METADATA;

    static EntryKind fromCode(int code) {
        EntryKind[] v = values();
        if (code < 0 || code >= v.length) throw new IllegalArgumentException("Unknown entry kind: " + code);
        return v[code];
    }
}
