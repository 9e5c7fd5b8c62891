package org.foxesworld.zimbridge.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Zero-copy, read-only window over bytes owned by someone else: either the guest value that
 * produced them or the engine's mapped archive storage.
 *
 * <p>The bytes are only reachable through a {@link View}, and each open view is counted.
 * Views may be released on another thread than the one that opened them. Closing the buffer
 * while views are active is a lifetime violation and fails with
 * {@link ErrorKind#BUFFER_STILL_VIEWED}.</p>
 */
public final class BufferView implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BufferView.class);

    /** Value of {@link #state} once closed; otherwise it holds the active view count. */
    private static final int CLOSED = -1;

    private final ByteBuffer bytes;
    private final Object owner;
    private final AtomicInteger state = new AtomicInteger();

    private BufferView(ByteBuffer bytes, Object owner) {
        this.bytes = bytes;
        this.owner = owner;
    }

    /** Exposes {@code bytes[position, limit)} without copying. */
    public static BufferView expose(ByteBuffer bytes) {
        return expose(bytes, null);
    }

    /**
     * Exposes {@code bytes[position, limit)} without copying, keeping {@code owner} reachable for
     * as long as this view is.
     */
    public static BufferView expose(ByteBuffer bytes, Object owner) {
        Objects.requireNonNull(bytes, "bytes");
        return new BufferView(bytes.slice().asReadOnlyBuffer(), owner);
    }

    public int size() {
        return bytes.capacity();
    }

    public Object owner() {
        return owner;
    }

    public View beginView() {
        while (true) {
            int n = state.get();
            if (n == CLOSED) throw new IllegalStateException("BufferView is closed");
            if (state.compareAndSet(n, n + 1)) return new View(this);
        }
    }

    public void endView() {
        while (true) {
            int n = state.get();
            if (n <= 0) throw new IllegalStateException("endView() without matching beginView()");
            if (state.compareAndSet(n, n - 1)) return;
        }
    }

    public int viewCount() {
        return Math.max(0, state.get());
    }

    public boolean isClosed() {
        return state.get() == CLOSED;
    }

    /** Closing twice is allowed. */
    @Override
    public void close() {
        if (state.compareAndSet(0, CLOSED)) return;
        int active = state.get();
        if (active == CLOSED) return;
        logger.error("Buffer of {} bytes released with {} active view(s)", size(), active);
        throw new BridgeException(ErrorKind.BUFFER_STILL_VIEWED, active + " active view(s)");
    }

    @Override
    public String toString() {
        int n = state.get();
        return "BufferView{size=" + size() + (n == CLOSED ? ", closed}" : ", views=" + n + '}');
    }

    /**
     * One active exposure. Every read checks that the view is still open; closing it ends the
     * view exactly once.
     */
    public static final class View implements AutoCloseable {
        private final BufferView parent;
        private final AtomicBoolean released = new AtomicBoolean();

        private View(BufferView parent) {
            this.parent = parent;
        }

        public BufferView parent() {
            return parent;
        }

        public int size() {
            return parent.size();
        }

        public byte byteAt(int index) {
            ensureOpen();
            return parent.bytes.get(index);
        }

        /**
         * Runs {@code reader} on a read-only duplicate of the bytes. The duplicate belongs to this
         * call and must not be kept once {@code reader} returns.
         */
        public <R> R read(Function<ByteBuffer, R> reader) {
            ensureOpen();
            return reader.apply(parent.bytes.duplicate());
        }

        /** Decodes the bytes as UTF-8. This copies. */
        public String text() {
            return read(b -> StandardCharsets.UTF_8.decode(b).toString());
        }

        /** Copies the bytes out. */
        public byte[] toByteArray() {
            return read(b -> {
                byte[] out = new byte[b.remaining()];
                b.get(out);
                return out;
            });
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                parent.endView();
            }
        }

        private void ensureOpen() {
            if (released.get()) throw new IllegalStateException("buffer view was released");
        }
    }
}
