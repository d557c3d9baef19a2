package com.ledgerimport.domain;

import java.math.BigDecimal;

/**
 * Application event: a budget category overran its plan, or the budget as a whole changed health.
 * {@code categoryId} is null for budget-level alerts.
 */
public record BudgetVarianceAlertEvent(
        String budgetId,
        String categoryId,
        Severity severity,
        BigDecimal variance,
        BigDecimal variancePercent,
        BudgetHealthStatus healthStatus,
        String message
) {

    public enum Severity {
        WARNING,
        CRITICAL
    }
}
