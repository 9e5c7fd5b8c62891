package org.foxesworld.zimbridge.engine.writer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Feeds an in-memory payload in one chunk. */
public final class StringProvider implements ContentProvider {

    private final byte[] content;
    private boolean fed;

    public StringProvider(String content) {
        this(Objects.requireNonNull(content, "content").getBytes(StandardCharsets.UTF_8));
    }

    public StringProvider(byte[] content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public long getSize() {
        return content.length;
    }

    @Override
    public Blob feed() {
        if (fed) return Blob.empty();
        fed = true;
        return Blob.of(content);
    }
}
