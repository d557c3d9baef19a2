package com.ledgerimport.reconciliation;

import com.ledgerimport.domain.Budget;
import com.ledgerimport.domain.BudgetHealthStatus;
import com.ledgerimport.domain.BudgetRepository;
import com.ledgerimport.domain.VariancePoint;
import com.ledgerimport.reconciliation.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@link BudgetDirectory} over the budgets collection.
 */
@Component
@RequiredArgsConstructor
public class MongoBudgetDirectory implements BudgetDirectory {

    private final BudgetRepository budgetRepository;
    private final ReconciliationProperties properties;

    @Override
    public Optional<Budget> findBudget(String budgetId) {
        return budgetRepository.findById(budgetId);
    }

    @Override
    public Optional<Budget> applyAmount(String budgetId, String categoryId, BigDecimal amount, String eventId) {
        return budgetRepository.incrementCategoryActual(budgetId, categoryId, amount, eventId);
    }

    @Override
    public void recordHealth(String budgetId, BudgetHealthStatus healthStatus, VariancePoint point) {
        budgetRepository.recordHealth(budgetId, healthStatus, point, Math.max(1, properties.getVarianceTrendLength()));
    }
}
