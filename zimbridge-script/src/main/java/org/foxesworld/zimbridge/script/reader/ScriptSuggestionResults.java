package org.foxesworld.zimbridge.script.reader;

import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.search.SuggestionResultSet;
import org.graalvm.polyglot.HostAccess;

public final class ScriptSuggestionResults {

    private final Wrapper<SuggestionResultSet> results;

    ScriptSuggestionResults(SuggestionResultSet results) {
        this.results = Wrapper.of(results);
    }

    @HostAccess.Export
    public int size() {
        return results.map(SuggestionResultSet::size);
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
