package org.foxesworld.zimbridge.script.adapter;

import org.foxesworld.zimbridge.engine.writer.GeoPosition;
import org.foxesworld.zimbridge.engine.writer.IndexData;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.dispatch.BridgeCalls;
import org.foxesworld.zimbridge.script.dispatch.ResultType;
import org.foxesworld.zimbridge.script.dispatch.TypedDispatcher;

import java.util.Objects;
import java.util.Optional;

public final class ScriptIndexData implements IndexData {

    private final ForeignHandle handle;
    private final TypedDispatcher dispatcher;

    public ScriptIndexData(ForeignHandle handle, TypedDispatcher dispatcher) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /** Objects without {@code has_indexdata} have none. */
    @Override
    public boolean hasIndexData() {
        if (!dispatcher.hasMethod(handle, "has_indexdata")) return false;
        return BridgeCalls.invoke(dispatcher, handle, "has_indexdata", ResultType.BOOL);
    }

    @Override
    public String getTitle() {
        return BridgeCalls.invoke(dispatcher, handle, "get_title", ResultType.TEXT);
    }

    @Override
    public String getContent() {
        return BridgeCalls.invoke(dispatcher, handle, "get_content", ResultType.TEXT);
    }

    @Override
    public String getKeywords() {
        return BridgeCalls.invoke(dispatcher, handle, "get_keywords", ResultType.TEXT);
    }

    @Override
    public int getWordCount() {
        return BridgeCalls.invoke(dispatcher, handle, "get_wordcount", ResultType.INT32);
    }

    @Override
    public Optional<GeoPosition> getPosition() {
        if (!dispatcher.hasMethod(handle, "get_geoposition")) return Optional.empty();
        return BridgeCalls.invoke(dispatcher, handle, "get_geoposition", ResultType.GEO_POSITION);
    }

    @Override
    public void close() {
        handle.close();
    }
}
