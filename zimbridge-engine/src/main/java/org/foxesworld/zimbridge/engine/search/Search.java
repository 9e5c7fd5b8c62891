package org.foxesworld.zimbridge.engine.search;

import java.util.List;

/**
 * Outcome of {@link Searcher#search(Query)}. Matches are computed once, so the estimate is
 * exact and paging is stable.
 */
public final class Search {

    private final String query;
    private final List<SearchResult> matches;

    Search(String query, List<SearchResult> matches) {
        this.query = query;
        this.matches = List.copyOf(matches);
    }

    public String getQuery() {
        return query;
    }

    public int getEstimatedMatches() {
        return matches.size();
    }

    /** Results {@code [start, start + maxResults)}, clipped to the available matches. */
    public SearchResultSet getResults(int start, int maxResults) {
        return new SearchResultSet(Pages.slice(matches, start, maxResults));
    }
}
