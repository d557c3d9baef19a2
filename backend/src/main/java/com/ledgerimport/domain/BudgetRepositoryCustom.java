package com.ledgerimport.domain;

import java.math.BigDecimal;
import java.util.Optional;

public interface BudgetRepositoryCustom {

    /**
     * Atomically add {@code amount} to the category's actual and record the event id.
     *
     * @return the budget after the update, or empty if budget or category does not exist
     */
    Optional<Budget> incrementCategoryActual(String budgetId, String categoryId, BigDecimal amount, String eventId);

    /** Store health and append a variance point, keeping the last {@code trendLength} points. */
    void recordHealth(String budgetId, BudgetHealthStatus healthStatus, VariancePoint point, int trendLength);
}
