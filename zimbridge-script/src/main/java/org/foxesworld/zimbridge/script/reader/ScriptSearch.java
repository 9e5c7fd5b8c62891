package org.foxesworld.zimbridge.script.reader;

import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.search.Search;
import org.graalvm.polyglot.HostAccess;

/** A finished full-text search, paged from JS with {@code results(start, count)}. */
public final class ScriptSearch {

    private final Wrapper<Search> search;

    ScriptSearch(Search search) {
        this.search = Wrapper.of(search);
    }

    @HostAccess.Export
    public String query() {
        return search.map(Search::getQuery);
    }

    @HostAccess.Export
    public int estimatedMatches() {
        return search.map(Search::getEstimatedMatches);
    }

    @HostAccess.Export
    public ScriptSearchResults results(int start, int count) {
        return new ScriptSearchResults(search.map(s -> s.getResults(start, count)));
    }
}
