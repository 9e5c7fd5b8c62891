package org.foxesworld.zimbridge.script.reader;

import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.search.SuggestionSearch;
import org.graalvm.polyglot.HostAccess;

public final class ScriptSuggestion {

    private final Wrapper<SuggestionSearch> suggestion;

    ScriptSuggestion(SuggestionSearch suggestion) {
        this.suggestion = Wrapper.of(suggestion);
    }

    @HostAccess.Export
    public String text() {
        return suggestion.map(SuggestionSearch::getText);
    }

    @HostAccess.Export
    public int estimatedMatches() {
        return suggestion.map(SuggestionSearch::getEstimatedMatches);
    }

    @HostAccess.Export
    public ScriptSuggestionResults results(int start, int count) {
        return new ScriptSuggestionResults(suggestion.map(s -> s.getResults(start, count)));
    }
}
