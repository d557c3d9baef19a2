package com.ledgerimport.domain;

import java.util.List;

/**
 * Machine categorization result applied to a staged transaction. {@code ruleId} is set when an authored rule matched;
 * budget linkage comes from that rule when present.
 */
public record CategoryAssignment(
        CategorySuggestion primary,
        CategorySource source,
        List<CategorySuggestion> alternatives,
        String ruleId,
        String budgetId,
        String budgetCategoryId
) {

    public CategoryAssignment {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static CategoryAssignment of(CategorySuggestion primary, CategorySource source) {
        return new CategoryAssignment(primary, source, List.of(), null, null, null);
    }
}
