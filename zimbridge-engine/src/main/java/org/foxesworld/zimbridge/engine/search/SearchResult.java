package org.foxesworld.zimbridge.engine.search;

import org.foxesworld.zimbridge.engine.reader.Archive;

/** An item matching a full-text query, and the archive it came from. */
public record SearchResult(Archive archive, String path, String title) {
}
