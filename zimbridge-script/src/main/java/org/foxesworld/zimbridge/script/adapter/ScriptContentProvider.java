package org.foxesworld.zimbridge.script.adapter;

import org.foxesworld.zimbridge.engine.writer.Blob;
import org.foxesworld.zimbridge.engine.writer.ContentProvider;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.dispatch.BridgeCalls;
import org.foxesworld.zimbridge.script.dispatch.ResultType;
import org.foxesworld.zimbridge.script.dispatch.TypedDispatcher;

import java.util.Objects;

/**
 * A script object with {@code get_size()} and {@code feed()} seen as an engine
 * {@link ContentProvider}. Once {@code feed()} returns an empty chunk the provider is exhausted
 * and no further guest calls are made.
 */
public final class ScriptContentProvider implements ContentProvider {

    public enum State { UNFED, EXHAUSTED }

    private final ForeignHandle handle;
    private final TypedDispatcher dispatcher;

    private volatile State state = State.UNFED;
    private volatile long fed;

    public ScriptContentProvider(ForeignHandle handle, TypedDispatcher dispatcher) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public long getSize() {
        return BridgeCalls.invoke(dispatcher, handle, "get_size", ResultType.INT64);
    }

    @Override
    public Blob feed() {
        if (state == State.EXHAUSTED) return Blob.empty();
        Blob chunk = BridgeCalls.invoke(dispatcher, handle, "feed", ResultType.BLOB);
        if (chunk.isEmpty()) {
            state = State.EXHAUSTED;
        } else {
            fed += chunk.size();
        }
        return chunk;
    }

    public State state() {
        return state;
    }

    public long bytesFed() {
        return fed;
    }

    @Override
    public void close() {
        handle.close();
    }
}
