package org.foxesworld.zimbridge.script.cache;

// Author: Calista Verner

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.graalvm.polyglot.Source;

import java.time.Duration;
import java.util.Objects;

/**
 * Caches for the script runtime: raw module text by module id, and built {@link Source}s keyed
 * by module id plus a content hash. Module exports are not cached here; the runtime owns them.
 */
public final class ScriptCaches {

    private final Cache<String, String> moduleText;
    private final Cache<SourceKey, Source> sources;

    private ScriptCaches(Cache<String, String> moduleText, Cache<SourceKey, Source> sources) {
        this.moduleText = Objects.requireNonNull(moduleText, "moduleText");
        this.sources = Objects.requireNonNull(sources, "sources");
    }

    public Cache<String, String> moduleText() { return moduleText; }

    public Cache<SourceKey, Source> sources() { return sources; }

    public void invalidateModule(String moduleId) {
        if (moduleId == null) return;
        moduleText.invalidate(moduleId);
        sources.asMap().keySet().removeIf(k -> moduleId.equals(k.name));
    }

    public void invalidateAll() {
        moduleText.invalidateAll();
        sources.invalidateAll();
    }

    /** Built sources are kept longer than module text. */
    public static ScriptCaches defaults() {
        Cache<String, String> moduleText = Caffeine.newBuilder()
                .maximumSize(256)
                .expireAfterAccess(Duration.ofMinutes(1))
                .build();

        Cache<SourceKey, Source> sources = Caffeine.newBuilder()
                .maximumSize(1_024)
                .expireAfterAccess(Duration.ofMinutes(10))
                .build();

        return new ScriptCaches(moduleText, sources);
    }

    /** Source name plus an FNV-1a hash of the code, so large code strings are not held as keys. */
    public static final class SourceKey {
        public final String name;
        public final long contentHash;

        private SourceKey(String name, long contentHash) {
            this.name = name;
            this.contentHash = contentHash;
        }

        public static SourceKey of(String name, String content) {
            return new SourceKey(Objects.requireNonNull(name, "name"), fnv1a64(content));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SourceKey)) return false;
            SourceKey that = (SourceKey) o;
            return contentHash == that.contentHash && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + Long.hashCode(contentHash);
        }

        @Override
        public String toString() {
            return "SourceKey{" + name + ", hash=" + Long.toHexString(contentHash) + '}';
        }
    }

    static long fnv1a64(String s) {
        if (s == null) return 0L;
        long h = 0xcbf29ce484222325L;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= 0x100000001b3L;
        }
        return h;
    }
}
