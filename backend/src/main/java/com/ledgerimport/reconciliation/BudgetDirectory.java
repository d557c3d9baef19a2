package com.ledgerimport.reconciliation;

import com.ledgerimport.domain.Budget;
import com.ledgerimport.domain.BudgetHealthStatus;
import com.ledgerimport.domain.VariancePoint;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Access to budget state owned by the budgeting service. Running totals live there; the reconciler only asks for
 * an amount to be applied and reads back the result.
 */
public interface BudgetDirectory {

    Optional<Budget> findBudget(String budgetId);

    /**
     * Atomically add {@code amount} (may be negative for corrections) to a category's actual.
     *
     * @return the budget after the change, or empty if budget or category is gone
     */
    Optional<Budget> applyAmount(String budgetId, String categoryId, BigDecimal amount, String eventId);

    void recordHealth(String budgetId, BudgetHealthStatus healthStatus, VariancePoint point);
}
