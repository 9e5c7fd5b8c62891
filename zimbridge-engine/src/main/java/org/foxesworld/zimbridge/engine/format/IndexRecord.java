package org.foxesworld.zimbridge.engine.format;

import org.foxesworld.zimbridge.engine.writer.GeoPosition;
import org.foxesworld.zimbridge.engine.writer.IndexData;

/**
 * What the indexer kept from an item's {@link IndexData}. Full-text content itself is not
 * stored, only its length.
 */
public record IndexRecord(String title, String keywords, int wordCount, int contentLength, GeoPosition position) {

    public static IndexRecord capture(IndexData data) {
        String content = data.getContent();
        return new IndexRecord(
                nullToEmpty(data.getTitle()),
                nullToEmpty(data.getKeywords()),
                data.getWordCount(),
                content == null ? 0 : content.length(),
                data.getPosition().orElse(null)
        );
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
