package org.foxesworld.zimbridge.engine.writer;

import java.util.Map;

/**
 * An entry to be written. Path, title, mimetype and hints are read on the thread that adds
 * the item; the content provider and index data are pulled later by a worker.
 */
public interface Item extends AutoCloseable {

    String getPath();

    String getTitle();

    String getMimeType();

    ContentProvider getContentProvider();

    default Map<Hint, Long> getHints() {
        return Map.of();
    }

    /** @return index data, or null when the item has none */
    default IndexData getIndexData() {
        return null;
    }

    /** Called by the engine once it no longer needs the item. */
    @Override
    default void close() {
    }
}
