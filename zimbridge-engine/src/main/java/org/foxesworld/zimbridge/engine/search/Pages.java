package org.foxesworld.zimbridge.engine.search;

import java.util.List;

final class Pages {

    private Pages() {
    }

    static <T> List<T> slice(List<T> all, int start, int maxResults) {
        if (start < 0) throw new IllegalArgumentException("start must be >= 0: " + start);
        if (maxResults < 0) throw new IllegalArgumentException("maxResults must be >= 0: " + maxResults);
        int from = Math.min(start, all.size());
        int to = (int) Math.min((long) from + maxResults, all.size());
        return all.subList(from, to);
    }
}
