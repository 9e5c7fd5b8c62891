package org.foxesworld.zimbridge.engine.reader;

import org.foxesworld.zimbridge.engine.format.DirEntry;
import org.foxesworld.zimbridge.engine.format.IndexRecord;
import org.foxesworld.zimbridge.engine.writer.Blob;
import org.foxesworld.zimbridge.engine.writer.Hint;

import java.util.Optional;

/** Content-bearing entry. */
public final class Item {

    private final Archive archive;
    private final DirEntry dir;

    Item(Archive archive, DirEntry dir) {
        this.archive = archive;
        this.dir = dir;
    }

    public String getPath() { return dir.path(); }
    public String getTitle() { return dir.displayTitle(); }
    public String getMimeType() { return dir.mimetype(); }
    public long getSize() { return dir.length(); }

    public int getIndex() {
        return archive.userId(dir);
    }

    public boolean isFrontArticle() {
        return dir.hasHint(Hint.FRONT_ARTICLE);
    }

    /** Zero-copy view of the content; the underlying buffer is read-only. */
    public Blob getData() {
        return Blob.of(archive.slice(dir));
    }

    public Optional<IndexRecord> getIndexRecord() {
        return Optional.ofNullable(dir.index());
    }

    @Override
    public String toString() {
        return "Item{" + dir.path() + ", " + dir.mimetype() + ", size=" + dir.length() + '}';
    }
}
