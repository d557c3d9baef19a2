package com.ledgerimport.domain;

/**
 * One candidate category with a 0-100 confidence.
 */
public record CategorySuggestion(String category, int confidence, String reasoning, SuggestionSource source) {

    public static final String UNCATEGORIZED = "Uncategorized";

    public CategorySuggestion {
        confidence = Math.max(0, Math.min(100, confidence));
    }

    public static CategorySuggestion uncategorized() {
        return new CategorySuggestion(UNCATEGORIZED, 0, "No matching pattern", SuggestionSource.NONE);
    }

    public boolean isUncategorized() {
        return UNCATEGORIZED.equals(category);
    }
}
