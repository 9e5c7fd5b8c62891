package org.foxesworld.zimbridge.engine.reader;

import org.foxesworld.zimbridge.engine.ArchiveException;
import org.foxesworld.zimbridge.engine.format.DirEntry;
import org.foxesworld.zimbridge.engine.writer.Hint;

/** A directory entry: either an item or a redirect to another entry. */
public final class Entry {

    private final Archive archive;
    private final DirEntry dir;

    Entry(Archive archive, DirEntry dir) {
        this.archive = archive;
        this.dir = dir;
    }

    public String getPath() { return dir.path(); }
    public String getTitle() { return dir.displayTitle(); }
    public boolean isRedirect() { return dir.isRedirect(); }

    /** Hint carried by this entry itself, not by the item a redirect leads to. */
    public boolean isFrontArticle() {
        return dir.hasHint(Hint.FRONT_ARTICLE);
    }

    /** Position among user entries, -1 for the synthetic main entry. */
    public int getIndex() {
        return archive.userId(dir);
    }

    /** The item behind this entry, following redirects. */
    public Item getItem() {
        return new Item(archive, archive.resolve(dir));
    }

    public Entry getRedirectEntry() {
        if (!dir.isRedirect()) throw new ArchiveException("Entry '" + dir.path() + "' is not a redirect");
        return new Entry(archive, archive.target(dir));
    }

    @Override
    public String toString() {
        return "Entry{" + dir.path() + (dir.isRedirect() ? " -> redirect" : "") + '}';
    }
}
