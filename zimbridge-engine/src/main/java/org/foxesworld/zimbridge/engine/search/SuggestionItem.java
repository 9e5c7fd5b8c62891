package org.foxesworld.zimbridge.engine.search;

public record SuggestionItem(String path, String title) {
}
