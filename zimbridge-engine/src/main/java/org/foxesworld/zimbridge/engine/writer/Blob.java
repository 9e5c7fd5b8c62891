package org.foxesworld.zimbridge.engine.writer;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable byte range handed between content providers and the engine. Wrapping never
 * copies; the backing memory belongs to whoever created the blob.
 */
public final class Blob {

    private static final Blob EMPTY = new Blob(ByteBuffer.allocate(0).asReadOnlyBuffer());

    private final ByteBuffer bytes;

    private Blob(ByteBuffer bytes) {
        this.bytes = bytes;
    }

    public static Blob empty() {
        return EMPTY;
    }

    public static Blob of(byte[] data) {
        Objects.requireNonNull(data, "data");
        return data.length == 0 ? EMPTY : new Blob(ByteBuffer.wrap(data).asReadOnlyBuffer());
    }

    public static Blob of(byte[] data, int offset, int length) {
        Objects.requireNonNull(data, "data");
        if (length == 0) return EMPTY;
        return new Blob(ByteBuffer.wrap(data, offset, length).slice().asReadOnlyBuffer());
    }

    public static Blob of(String text) {
        Objects.requireNonNull(text, "text");
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Wraps {@code buffer[position, limit)}. */
    public static Blob of(ByteBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        if (!buffer.hasRemaining()) return EMPTY;
        return new Blob(buffer.slice().asReadOnlyBuffer());
    }

    public int size() {
        return bytes.capacity();
    }

    public boolean isEmpty() {
        return bytes.capacity() == 0;
    }

    /** Read-only duplicate positioned at 0. */
    public ByteBuffer data() {
        return bytes.duplicate();
    }

    public byte[] toByteArray() {
        ByteBuffer b = data();
        byte[] out = new byte[b.remaining()];
        b.get(out);
        return out;
    }

    public String text() {
        return StandardCharsets.UTF_8.decode(data()).toString();
    }

    @Override
    public String toString() {
        return "Blob{size=" + size() + '}';
    }
}
