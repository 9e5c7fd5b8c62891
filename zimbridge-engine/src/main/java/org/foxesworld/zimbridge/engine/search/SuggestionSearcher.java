package org.foxesworld.zimbridge.engine.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.engine.reader.Archive;
import org.foxesworld.zimbridge.engine.reader.Entry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Title suggestions over the front articles of an archive. Every term of the text must start
 * some word of the title. Matches are sorted by title, ignoring case, then by path.
 */
public final class SuggestionSearcher {

    private static final Logger log = LogManager.getLogger(SuggestionSearcher.class);

    private static final Comparator<SuggestionItem> ORDER = Comparator
            .comparing((SuggestionItem i) -> i.title().toLowerCase(Locale.ROOT))
            .thenComparing(SuggestionItem::path);

    private final Archive archive;

    public SuggestionSearcher(Archive archive) {
        this.archive = Objects.requireNonNull(archive, "archive");
    }

    public SuggestionSearch suggest(String text) {
        List<String> terms = Query.words(text);
        List<SuggestionItem> matches = new ArrayList<>();
        if (!terms.isEmpty()) {
            for (int id = 0; id < archive.getEntryCount(); id++) {
                Entry entry = archive.getEntryById(id);
                if (!entry.isFrontArticle()) continue;
                if (startsWords(Query.words(entry.getTitle()), terms)) {
                    matches.add(new SuggestionItem(entry.getPath(), entry.getTitle()));
                }
            }
            matches.sort(ORDER);
        }
        log.debug("[zim] suggestions for '{}': {}", text, matches.size());
        return new SuggestionSearch(text == null ? "" : text, matches);
    }

    private static boolean startsWords(List<String> words, List<String> terms) {
        for (String term : terms) {
            boolean found = false;
            for (String w : words) {
                if (w.startsWith(term)) {
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }
}
