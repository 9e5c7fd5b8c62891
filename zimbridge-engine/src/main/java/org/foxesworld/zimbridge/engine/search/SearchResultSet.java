package org.foxesworld.zimbridge.engine.search;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** One page of search results, in match order. */
public final class SearchResultSet implements Iterable<SearchResult> {

    private final List<SearchResult> results;

    SearchResultSet(List<SearchResult> results) {
        this.results = List.copyOf(results);
    }

    public int size() {
        return results.size();
    }

    public SearchResult get(int index) {
        return results.get(index);
    }

    public List<String> paths() {
        List<String> out = new ArrayList<>(results.size());
        for (SearchResult r : results) out.add(r.path());
        return out;
    }

    @Override
    public Iterator<SearchResult> iterator() {
        return results.iterator();
    }
}
