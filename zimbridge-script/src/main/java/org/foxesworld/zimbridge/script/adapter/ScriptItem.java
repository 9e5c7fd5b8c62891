package org.foxesworld.zimbridge.script.adapter;

import org.foxesworld.zimbridge.engine.writer.ContentProvider;
import org.foxesworld.zimbridge.engine.writer.Hint;
import org.foxesworld.zimbridge.engine.writer.IndexData;
import org.foxesworld.zimbridge.engine.writer.Item;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.dispatch.BridgeCalls;
import org.foxesworld.zimbridge.script.dispatch.ResultType;
import org.foxesworld.zimbridge.script.dispatch.TypedDispatcher;

import java.util.Map;
import java.util.Objects;

/**
 * A script object seen as an engine {@link Item}. The object provides {@code get_path},
 * {@code get_title}, {@code get_mimetype} and {@code get_contentprovider}; {@code get_hints}
 * and {@code get_indexdata} are optional.
 */
public final class ScriptItem implements Item {

    private final ForeignHandle handle;
    private final TypedDispatcher dispatcher;

    public ScriptItem(ForeignHandle handle, TypedDispatcher dispatcher) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public String getPath() {
        return BridgeCalls.invoke(dispatcher, handle, "get_path", ResultType.TEXT);
    }

    @Override
    public String getTitle() {
        return BridgeCalls.invoke(dispatcher, handle, "get_title", ResultType.TEXT);
    }

    @Override
    public String getMimeType() {
        return BridgeCalls.invoke(dispatcher, handle, "get_mimetype", ResultType.TEXT);
    }

    @Override
    public ContentProvider getContentProvider() {
        return BridgeCalls.invoke(dispatcher, handle, "get_contentprovider", ResultType.CONTENT_PROVIDER);
    }

    @Override
    public Map<Hint, Long> getHints() {
        if (!dispatcher.hasMethod(handle, "get_hints")) return Map.of();
        return BridgeCalls.invoke(dispatcher, handle, "get_hints", ResultType.HINTS);
    }

    @Override
    public IndexData getIndexData() {
        if (!dispatcher.hasMethod(handle, "get_indexdata")) return null;
        return BridgeCalls.invoke(dispatcher, handle, "get_indexdata", ResultType.INDEX_DATA);
    }

    public boolean isReleased() {
        return !handle.isSet();
    }

    @Override
    public void close() {
        handle.close();
    }
}
