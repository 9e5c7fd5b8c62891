package org.foxesworld.zimbridge.engine.format;

import org.foxesworld.zimbridge.engine.writer.Hint;

/**
 * One directory record of a container file.
 *
 * @param id       position in the directory
 * @param offset   start of the content in the data region (items and metadata)
 * @param target   directory id of the redirect target, -1 otherwise
 * @param index    captured index data, null when the item had none
 */
public record DirEntry(int id, EntryKind kind, String path, String title, String mimetype,
                       long offset, long length, int hintFlags, int target, IndexRecord index) {

    public boolean hasHint(Hint hint) {
        return (hintFlags & hint.flag()) != 0;
    }

    public boolean isRedirect() {
        return kind == EntryKind.REDIRECT;
    }

    /** Title, falling back to the path when no title was given. */
    public String displayTitle() {
        return title.isEmpty() ? path : title;
    }
}
