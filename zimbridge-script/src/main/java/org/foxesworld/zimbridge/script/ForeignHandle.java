package org.foxesworld.zimbridge.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorKind;
import org.graalvm.polyglot.Value;

import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owning reference to one guest object. While the handle is set it accounts for exactly one pin
 * in the runtime's pin table.
 *
 * <p>Move-only: there is no copy. {@link #moveTo()} transfers ownership without touching the pin
 * count and leaves this handle unset. {@link #close()} unpins under the execution lock and may
 * run on any thread; a handle that is dropped without being closed is unpinned by a
 * {@link Cleaner}.</p>
 */
public final class ForeignHandle implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ForeignHandle.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final ScriptRuntime runtime;
    private final AtomicReference<Value> ref;
    private final Cleaner.Cleanable cleanable;

    private ForeignHandle(ScriptRuntime runtime, AtomicReference<Value> ref) {
        this.runtime = runtime;
        this.ref = ref;
        this.cleanable = CLEANER.register(this, new Release(runtime, ref));
    }

    /** Pins {@code value} and returns the handle that owns that pin. */
    public static ForeignHandle acquire(ScriptRuntime runtime, Value value) {
        Objects.requireNonNull(runtime, "runtime");
        if (value == null) throw new BridgeException(ErrorKind.HANDLE_NOT_SET, "cannot acquire a null value");
        if (runtime.isClosed()) throw new BridgeException(ErrorKind.RUNTIME_UNAVAILABLE, "script runtime is closed");
        runtime.pin(value);
        return new ForeignHandle(runtime, new AtomicReference<>(value));
    }

    public boolean isSet() {
        return ref.get() != null;
    }

    /** The held guest value. Use only under the runtime's execution lock. */
    public Value value() {
        Value v = ref.get();
        if (v == null) throw new BridgeException(ErrorKind.HANDLE_NOT_SET, "handle was moved or closed");
        return v;
    }

    public ScriptRuntime runtime() {
        return runtime;
    }

    /** Transfers the held object to a new handle; this one becomes unset. */
    public ForeignHandle moveTo() {
        Value v = ref.getAndSet(null);
        if (v == null) throw new BridgeException(ErrorKind.HANDLE_NOT_SET, "handle was moved or closed");
        cleanable.clean();
        return new ForeignHandle(runtime, new AtomicReference<>(v));
    }

    @Override
    public void close() {
        cleanable.clean();
    }

    @Override
    public String toString() {
        return isSet() ? "ForeignHandle{set}" : "ForeignHandle{unset}";
    }

    private static final class Release implements Runnable {
        private final ScriptRuntime runtime;
        private final AtomicReference<Value> ref;

        Release(ScriptRuntime runtime, AtomicReference<Value> ref) {
            this.runtime = runtime;
            this.ref = ref;
        }

        @Override
        public void run() {
            Value v = ref.getAndSet(null);
            if (v == null) return;
            try {
                runtime.unpin(v);
            } catch (RuntimeException e) {
                log.warn("[script] failed to unpin guest object", e);
            }
        }
    }
}
