package org.foxesworld.zimbridge.engine.search;

import java.util.List;

/** Outcome of {@link SuggestionSearcher#suggest(String)}. */
public final class SuggestionSearch {

    private final String text;
    private final List<SuggestionItem> matches;

    SuggestionSearch(String text, List<SuggestionItem> matches) {
        this.text = text;
        this.matches = List.copyOf(matches);
    }

    public String getText() {
        return text;
    }

    public int getEstimatedMatches() {
        return matches.size();
    }

    public SuggestionResultSet getResults(int start, int maxResults) {
        return new SuggestionResultSet(Pages.slice(matches, start, maxResults));
    }
}
