package org.foxesworld.zimbridge.engine.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.engine.ArchiveException;
import org.foxesworld.zimbridge.engine.format.IndexRecord;
import org.foxesworld.zimbridge.engine.reader.Archive;
import org.foxesworld.zimbridge.engine.reader.Entry;
import org.foxesworld.zimbridge.engine.reader.Item;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Unranked full-text search over one or more archives.
 *
 * <p>Searchable items are those that carry an index record, plus HTML items. An item matches
 * when every query term is one of its words: title, indexed title and keywords, and the content
 * of text items. Results come in archive order, then entry order. Archives built without a
 * full-text index are skipped.</p>
 */
public final class Searcher {

    private static final Logger log = LogManager.getLogger(Searcher.class);

    private final List<Archive> archives = new ArrayList<>();

    public Searcher(Archive archive) {
        addArchive(archive);
    }

    public Searcher addArchive(Archive archive) {
        archives.add(Objects.requireNonNull(archive, "archive"));
        return this;
    }

    public Search search(Query query) {
        Objects.requireNonNull(query, "query");
        List<String> terms = query.terms();
        List<SearchResult> matches = new ArrayList<>();
        int searched = 0;

        for (Archive archive : archives) {
            if (!archive.hasFulltextIndex()) {
                log.debug("[zim] {} has no full-text index, skipped", archive.getFilename());
                continue;
            }
            searched++;
            if (terms.isEmpty()) continue;
            for (int id = 0; id < archive.getEntryCount(); id++) {
                Entry entry = archive.getEntryById(id);
                if (entry.isRedirect()) continue;
                Item item = entry.getItem();
                if (!searchable(item)) continue;
                if (words(item).containsAll(terms)) matches.add(new SearchResult(archive, item.getPath(), item.getTitle()));
            }
        }

        if (searched == 0) throw new ArchiveException("Cannot search: no archive has a full-text index");
        log.debug("[zim] query '{}' matched {} item(s)", query.getQuery(), matches.size());
        return new Search(query.getQuery(), matches);
    }

    private static boolean searchable(Item item) {
        return item.getIndexRecord().isPresent() || item.getMimeType().startsWith("text/html");
    }

    private static Set<String> words(Item item) {
        Set<String> words = new HashSet<>(Query.words(item.getTitle()));
        IndexRecord record = item.getIndexRecord().orElse(null);
        if (record != null) {
            words.addAll(Query.words(record.title()));
            words.addAll(Query.words(record.keywords()));
        }
        if (item.getMimeType().startsWith("text/")) words.addAll(Query.words(item.getData().text()));
        return words;
    }
}
