package org.foxesworld.zimbridge.engine.writer;

import java.util.Optional;

/** Text the indexer should use for an item instead of its raw content. */
public interface IndexData extends AutoCloseable {

    boolean hasIndexData();

    String getTitle();

    String getContent();

    String getKeywords();

    int getWordCount();

    Optional<GeoPosition> getPosition();

    @Override
    default void close() {
    }
}
