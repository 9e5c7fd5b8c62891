package org.foxesworld.zimbridge.engine.search;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public final class SuggestionResultSet implements Iterable<SuggestionItem> {

    private final List<SuggestionItem> items;

    SuggestionResultSet(List<SuggestionItem> items) {
        this.items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public SuggestionItem get(int index) {
        return items.get(index);
    }

    public List<String> paths() {
        List<String> out = new ArrayList<>(items.size());
        for (SuggestionItem i : items) out.add(i.path());
        return out;
    }

    @Override
    public Iterator<SuggestionItem> iterator() {
        return items.iterator();
    }
}
