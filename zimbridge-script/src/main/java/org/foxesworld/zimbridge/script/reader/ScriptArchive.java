package org.foxesworld.zimbridge.script.reader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.reader.Archive;
import org.foxesworld.zimbridge.engine.search.Query;
import org.foxesworld.zimbridge.engine.search.Searcher;
import org.foxesworld.zimbridge.engine.search.SuggestionSearcher;
import org.graalvm.polyglot.HostAccess;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** An opened {@link Archive} as seen from JS. */
public final class ScriptArchive implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ScriptArchive.class);

    private final Wrapper<Archive> archive;

    public ScriptArchive(Archive archive) {
        this.archive = Wrapper.of(archive);
    }

    public static ScriptArchive open(Path file) {
        try {
            return new ScriptArchive(Archive.open(file));
        } catch (IOException e) {
            log.error("[reader] cannot open {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Cannot open archive " + file, e);
        }
    }

    public Archive archive() {
        return archive.get();
    }

    @HostAccess.Export
    public String filename() {
        return archive.map(a -> a.getFilename().toString());
    }

    @HostAccess.Export
    public long filesize() {
        return archive.map(Archive::getFilesize);
    }

    @HostAccess.Export
    public String uuid() {
        return archive.map(a -> a.getUuid().toString());
    }

    @HostAccess.Export
    public int entryCount() {
        return archive.map(Archive::getEntryCount);
    }

    @HostAccess.Export
    public int allEntryCount() {
        return archive.map(Archive::getAllEntryCount);
    }

    @HostAccess.Export
    public int articleCount() {
        return archive.map(Archive::getArticleCount);
    }

    @HostAccess.Export
    public int mediaCount() {
        return archive.map(Archive::getMediaCount);
    }

    @HostAccess.Export
    public boolean hasFulltextIndex() {
        return archive.map(Archive::hasFulltextIndex);
    }

    @HostAccess.Export
    public boolean hasTitleIndex() {
        return archive.map(Archive::hasTitleIndex);
    }

    @HostAccess.Export
    public boolean hasChecksum() {
        return archive.map(Archive::hasChecksum);
    }

    @HostAccess.Export
    public String checksum() {
        return archive.map(Archive::getChecksum);
    }

    /** Recomputes the checksum; reads the whole file. */
    @HostAccess.Export
    public boolean check() {
        return archive.map(Archive::check);
    }

    @HostAccess.Export
    public ScriptSearch search(String query) {
        return new ScriptSearch(archive.map(a -> new Searcher(a).search(new Query().setQuery(query))));
    }

    @HostAccess.Export
    public ScriptSuggestion suggest(String text) {
        return new ScriptSuggestion(archive.map(a -> new SuggestionSearcher(a).suggest(text)));
    }

    @HostAccess.Export
    public boolean hasMainEntry() {
        return archive.map(Archive::hasMainEntry);
    }

    @HostAccess.Export
    public ScriptEntry mainEntry() {
        return new ScriptEntry(archive.map(Archive::getMainEntry));
    }

    @HostAccess.Export
    public boolean hasEntryByPath(String path) {
        return archive.map(a -> a.hasEntryByPath(path));
    }

    @HostAccess.Export
    public ScriptEntry entryByPath(String path) {
        return new ScriptEntry(archive.map(a -> a.getEntryByPath(path)));
    }

    @HostAccess.Export
    public boolean hasEntryByTitle(String title) {
        return archive.map(a -> a.hasEntryByTitle(title));
    }

    @HostAccess.Export
    public ScriptEntry entryByTitle(String title) {
        return new ScriptEntry(archive.map(a -> a.getEntryByTitle(title)));
    }

    @HostAccess.Export
    public ScriptEntry entryById(int id) {
        return new ScriptEntry(archive.map(a -> a.getEntryById(id)));
    }

    @HostAccess.Export
    public String[] metadataKeys() {
        List<String> keys = archive.map(Archive::getMetadataKeys);
        return keys.toArray(new String[0]);
    }

    /** Metadata value decoded as UTF-8. */
    @HostAccess.Export
    public String metadata(String name) {
        return new String(archive.map(a -> a.getMetadata(name)), StandardCharsets.UTF_8);
    }

    @HostAccess.Export
    public ScriptItemView metadataItem(String name) {
        return new ScriptItemView(archive.map(a -> a.getMetadataItem(name)));
    }

    @HostAccess.Export
    public int[] illustrationSizes() {
        Set<Integer> sizes = archive.map(Archive::getIllustrationSizes);
        return sizes.stream().mapToInt(Integer::intValue).toArray();
    }

    @HostAccess.Export
    public ScriptItemView illustrationItem(int size) {
        return new ScriptItemView(archive.map(a -> a.getIllustrationItem(size)));
    }

    @HostAccess.Export
    @Override
    public void close() {
        if (archive.isEmpty()) return;
        archive.moveTo().get().close();
    }

    @Override
    public String toString() {
        return archive.isEmpty() ? "ScriptArchive{closed}" : "ScriptArchive{" + archive.get() + '}';
    }
}
