package org.foxesworld.zimbridge.engine.reader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.engine.ArchiveException;
import org.foxesworld.zimbridge.engine.format.ContainerFormat;
import org.foxesworld.zimbridge.engine.format.ContainerHeader;
import org.foxesworld.zimbridge.engine.format.ContainerIndex;
import org.foxesworld.zimbridge.engine.format.ContainerReader;
import org.foxesworld.zimbridge.engine.format.DirEntry;
import org.foxesworld.zimbridge.engine.format.EntryKind;
import org.foxesworld.zimbridge.engine.writer.Compression;
import org.foxesworld.zimbridge.engine.writer.Creator;
import org.foxesworld.zimbridge.engine.writer.Hint;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only view of an archive file. The file is memory-mapped once; item data handed out by
 * {@link Item#getData()} are slices of that mapping and stay valid as long as they are
 * referenced. Safe for concurrent readers.
 */
public final class Archive implements Closeable {

    private static final Logger log = LogManager.getLogger(Archive.class);

    private static final Pattern ILLUSTRATION = Pattern.compile("Illustration_(\\d+)x(\\d+)@1");
    private static final int MAX_REDIRECT_HOPS = 50;

    private final Path filename;
    private final long filesize;
    private final ByteBuffer mapped;
    private final ContainerIndex index;

    private final List<DirEntry> entries;
    private final Map<String, DirEntry> byPath = new HashMap<>();
    private final Map<String, DirEntry> byTitle = new TreeMap<>();
    private final Map<String, DirEntry> metadata = new TreeMap<>();

    private volatile boolean closed;

    private Archive(Path filename, long filesize, ByteBuffer mapped, ContainerIndex index) {
        this.filename = filename;
        this.filesize = filesize;
        this.mapped = mapped;
        this.index = index;

        List<DirEntry> list = new ArrayList<>();
        for (DirEntry e : index.entries()) {
            if (e.kind() == EntryKind.METADATA) {
                metadata.put(e.path(), e);
                continue;
            }
            list.add(e);
            byPath.put(e.path(), e);
            byTitle.putIfAbsent(e.displayTitle(), e);
        }
        this.entries = Collections.unmodifiableList(list);
    }

    public static Archive open(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = ch.size();
            if (size > Integer.MAX_VALUE) throw new ArchiveException("Archive too large to map: " + size + " bytes");
            MappedByteBuffer map = ch.map(FileChannel.MapMode.READ_ONLY, 0, size);
            ContainerIndex idx = ContainerReader.read(map);
            log.debug("[zim] opened {} entries={} size={}", file, idx.entries().size(), size);
            return new Archive(file, size, map.asReadOnlyBuffer(), idx);
        }
    }

    // ----------------------------
    // Archive-level info
    // ----------------------------

    public Path getFilename() { return filename; }
    public long getFilesize() { return filesize; }

    public UUID getUuid() {
        return header().uuid();
    }

    public Compression getCompression() {
        return header().compression();
    }

    public boolean hasFulltextIndex() {
        return header().indexed();
    }

    public String getIndexLanguage() {
        return header().language();
    }

    public boolean hasChecksum() {
        return header().hasChecksum();
    }

    /** Stored MD5 as 32 lowercase hex digits, empty when the archive has none. */
    public String getChecksum() {
        byte[] sum = header().checksum();
        return sum == null ? "" : HexFormat.of().formatHex(sum);
    }

    /**
     * Recomputes the checksum over the file and compares it with the stored one. An archive
     * without a checksum never checks out.
     */
    public boolean check() {
        ensureOpen();
        byte[] stored = header().checksum();
        if (stored == null) return false;
        ByteBuffer covered = mapped.duplicate();
        covered.position(0);
        covered.limit((int) index.checksummedLength());
        MessageDigest digest = ContainerFormat.checksumDigest();
        digest.update(covered);
        boolean valid = MessageDigest.isEqual(stored, digest.digest());
        if (!valid) log.warn("[zim] checksum mismatch in {}", filename);
        return valid;
    }

    /** Front articles are listed in the title index used for suggestions. */
    public boolean hasTitleIndex() {
        ensureOpen();
        for (DirEntry e : entries) {
            if (e.hasHint(Hint.FRONT_ARTICLE)) return true;
        }
        return false;
    }

    /** Number of user entries (items and redirects). */
    public int getEntryCount() {
        return entries.size();
    }

    public int getAllEntryCount() {
        return index.entries().size();
    }

    public int getArticleCount() {
        ensureOpen();
        int n = 0;
        for (DirEntry e : entries) {
            if (e.kind() == EntryKind.ITEM && e.hasHint(Hint.FRONT_ARTICLE)) n++;
        }
        return n;
    }

    public int getMediaCount() {
        ensureOpen();
        int n = 0;
        for (DirEntry e : entries) {
            if (e.kind() == EntryKind.ITEM && !e.mimetype().startsWith("text/")) n++;
        }
        return n;
    }

    // ----------------------------
    // Entries
    // ----------------------------

    public boolean hasEntryByPath(String path) {
        ensureOpen();
        return byPath.containsKey(path);
    }

    public Entry getEntryByPath(String path) {
        ensureOpen();
        DirEntry e = byPath.get(path);
        if (e == null) throw new ArchiveException("Cannot find entry '" + path + "'");
        return new Entry(this, e);
    }

    public boolean hasEntryByTitle(String title) {
        ensureOpen();
        return byTitle.containsKey(title);
    }

    public Entry getEntryByTitle(String title) {
        ensureOpen();
        DirEntry e = byTitle.get(title);
        if (e == null) throw new ArchiveException("Cannot find entry with title '" + title + "'");
        return new Entry(this, e);
    }

    /** @param id position among user entries, ordered by path */
    public Entry getEntryById(int id) {
        ensureOpen();
        if (id < 0 || id >= entries.size()) throw new ArchiveException("Entry id out of range: " + id);
        return new Entry(this, entries.get(id));
    }

    public boolean hasMainEntry() {
        return header().mainTarget() >= 0;
    }

    /** A redirect named {@code mainPage} pointing at the configured main path. */
    public Entry getMainEntry() {
        ensureOpen();
        int t = header().mainTarget();
        if (t < 0) throw new ArchiveException("No main entry");
        DirEntry main = new DirEntry(-1, EntryKind.REDIRECT, "mainPage", "mainPage", "", 0, 0, 0, t, null);
        return new Entry(this, main);
    }

    public Optional<Entry> findEntry(String path) {
        ensureOpen();
        DirEntry e = byPath.get(path);
        return e == null ? Optional.empty() : Optional.of(new Entry(this, e));
    }

    // ----------------------------
    // Metadata
    // ----------------------------

    public List<String> getMetadataKeys() {
        ensureOpen();
        return List.copyOf(metadata.keySet());
    }

    public byte[] getMetadata(String name) {
        return getMetadataItem(name).getData().toByteArray();
    }

    public Item getMetadataItem(String name) {
        ensureOpen();
        DirEntry e = metadata.get(name);
        if (e == null) throw new ArchiveException("Cannot find metadata '" + name + "'");
        return new Item(this, e);
    }

    public Set<Integer> getIllustrationSizes() {
        ensureOpen();
        Set<Integer> sizes = new TreeSet<>();
        for (String key : metadata.keySet()) {
            Matcher m = ILLUSTRATION.matcher(key);
            if (m.matches() && m.group(1).equals(m.group(2))) sizes.add(Integer.parseInt(m.group(1)));
        }
        return sizes;
    }

    public boolean hasIllustration(int size) {
        ensureOpen();
        return metadata.containsKey(Creator.illustrationName(size));
    }

    public Item getIllustrationItem(int size) {
        ensureOpen();
        DirEntry e = metadata.get(Creator.illustrationName(size));
        if (e == null) throw new ArchiveException("Cannot find illustration of size " + size);
        return new Item(this, e);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    /** Zero-copy read-only slice of an entry's content. */
    ByteBuffer slice(DirEntry e) {
        ensureOpen();
        ByteBuffer b = mapped.duplicate();
        int start = (int) (index.dataStart() + e.offset());
        b.position(start);
        b.limit(start + (int) e.length());
        return b.slice();
    }

    DirEntry resolve(DirEntry e) {
        DirEntry cur = e;
        for (int hops = 0; cur.isRedirect(); hops++) {
            if (hops >= MAX_REDIRECT_HOPS) throw new ArchiveException("Redirect loop at '" + e.path() + "'");
            cur = index.entries().get(cur.target());
        }
        return cur;
    }

    DirEntry target(DirEntry e) {
        return index.entries().get(e.target());
    }

    int userId(DirEntry e) {
        if (e.id() < 0) return -1;
        int i = Collections.binarySearch(entries, e, (a, b) -> Integer.compare(a.id(), b.id()));
        return i < 0 ? -1 : i;
    }

    private ContainerHeader header() {
        return index.header();
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Archive is closed");
    }

    public boolean isClosed() {
        return closed;
    }

    /** Further lookups fail. Slices already handed out stay readable. */
    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return "Archive{" + filename + ", entries=" + entries.size() + '}';
    }
}
