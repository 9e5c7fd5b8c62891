package org.foxesworld.zimbridge.engine.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Free-text query. Its terms are the lowercase runs of letters and digits in the query string. */
public final class Query {

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private String query = "";

    public Query setQuery(String query) {
        this.query = query == null ? "" : query;
        return this;
    }

    public String getQuery() {
        return query;
    }

    public List<String> terms() {
        return words(query);
    }

    static List<String> words(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        for (String w : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }

    @Override
    public String toString() {
        return "Query{" + query + '}';
    }
}
