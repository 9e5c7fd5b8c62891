package org.foxesworld.zimbridge.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Default-constructible, movable box around an engine value that can only be obtained from
 * the engine itself (archives, entries, items, blobs).
 *
 * <p>An empty wrapper is "unset"; every read on it fails with
 * {@link ErrorKind#NOT_INITIALIZED}. Ownership moves with {@link #moveTo()} and
 * {@link #moveFrom(Wrapper)}; after a move the source is empty, so one instance is never held
 * by two wrappers.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class Wrapper<T> {

    private T value;

    private Wrapper(T value) {
        this.value = value;
    }

    public static <T> Wrapper<T> empty() {
        return new Wrapper<>(null);
    }

    public static <T> Wrapper<T> of(T value) {
        return new Wrapper<>(Objects.requireNonNull(value, "value"));
    }

    public boolean isEmpty() {
        return value == null;
    }

    public T get() {
        T v = value;
        if (v == null) throw new BridgeException(ErrorKind.NOT_INITIALIZED, null);
        return v;
    }

    /** Forwards a read to the boxed instance. */
    public <R> R map(Function<? super T, ? extends R> read) {
        return read.apply(get());
    }

    /** Transfers the boxed instance into a new wrapper; this one becomes empty. */
    public Wrapper<T> moveTo() {
        Wrapper<T> out = new Wrapper<>(value);
        value = null;
        return out;
    }

    /** Takes over the instance held by {@code other}, dropping whatever this wrapper held. */
    public Wrapper<T> moveFrom(Wrapper<T> other) {
        if (other == this) return this;
        value = other.value;
        other.value = null;
        return this;
    }

    @Override
    public String toString() {
        return value == null ? "Wrapper{empty}" : "Wrapper{" + value + '}';
    }
}
