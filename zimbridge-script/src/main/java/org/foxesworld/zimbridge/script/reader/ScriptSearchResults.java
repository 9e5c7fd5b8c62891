package org.foxesworld.zimbridge.script.reader;

import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.search.SearchResultSet;
import org.graalvm.polyglot.HostAccess;

public final class ScriptSearchResults {

    private final Wrapper<SearchResultSet> results;

    ScriptSearchResults(SearchResultSet results) {
        this.results = Wrapper.of(results);
    }

    @HostAccess.Export
    public int size() {
        return results.map(SearchResultSet::size);
    }

    @HostAccess.Export
    public String path(int index) {
        return results.map(r -> r.get(index).path());
    }

    @HostAccess.Export
    public String title(int index) {
        return results.map(r -> r.get(index).title());
    }

    @HostAccess.Export
    public String[] paths() {
        return results.map(r -> r.paths().toArray(new String[0]));
    }
}
