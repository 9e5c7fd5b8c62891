package org.foxesworld.zimbridge.engine.format;

/**
 * Entry as handed to {@link ContainerWriter}. Entries sharing the same {@code content} array
 * share their stored bytes.
 *
 * @param targetPath redirect target path, null for non-redirects
 */
public record WriteEntry(EntryKind kind, String path, String title, String mimetype,
                         byte[] content, int hintFlags, String targetPath, IndexRecord index) {
}
