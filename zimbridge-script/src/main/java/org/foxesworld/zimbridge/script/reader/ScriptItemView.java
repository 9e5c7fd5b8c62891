package org.foxesworld.zimbridge.script.reader;

import org.foxesworld.zimbridge.core.BufferView;
import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.reader.Item;
import org.graalvm.polyglot.HostAccess;

/**
 * A reader {@link Item} as seen from JS. Content is exposed zero-copy: {@link #content()} hands
 * out a view over the archive mapping, which must be released before the item view is closed.
 */
public final class ScriptItemView implements AutoCloseable {

    private final Wrapper<Item> item;
    private BufferView data;

    public ScriptItemView(Item item) {
        this.item = Wrapper.of(item);
    }

    @HostAccess.Export
    public String path() {
        return item.map(Item::getPath);
    }

    @HostAccess.Export
    public String title() {
        return item.map(Item::getTitle);
    }

    @HostAccess.Export
    public String mimetype() {
        return item.map(Item::getMimeType);
    }

    @HostAccess.Export
    public long size() {
        return item.map(Item::getSize);
    }

    @HostAccess.Export
    public int index() {
        return item.map(Item::getIndex);
    }

    /** Opens a new view on the item's bytes. */
    @HostAccess.Export
    public synchronized ScriptBuffer content() {
        if (data == null) {
            Item i = item.get();
            data = BufferView.expose(i.getData().data(), i);
        }
        return new ScriptBuffer(data.beginView());
    }

    /** Active {@link #content()} views not yet released. */
    @HostAccess.Export
    public synchronized int activeViews() {
        return data == null ? 0 : data.viewCount();
    }

    /**
     * Releases the item's buffer.
     *
     * @throws org.foxesworld.zimbridge.core.BridgeException {@code BUFFER_STILL_VIEWED} when a
     *         content view is still active
     */
    @HostAccess.Export
    @Override
    public synchronized void close() {
        if (data != null) data.close();
    }
}
