package com.ledgerimport.reconciliation;

import com.ledgerimport.domain.Budget;
import com.ledgerimport.domain.BudgetCategory;
import com.ledgerimport.domain.BudgetHealthStatus;
import com.ledgerimport.domain.BudgetVarianceAlertEvent;
import com.ledgerimport.domain.ReconciliationResult;
import com.ledgerimport.domain.ReconciliationResultRepository;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.domain.VariancePoint;
import com.ledgerimport.reconciliation.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies ledger event amounts to linked budget categories and recomputes variance and whole-budget health.
 * Health by ratio of total actual to total planned: up to warningRatio HEALTHY, up to criticalRatio WARNING,
 * above CRITICAL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetReconciler {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final BudgetDirectory budgetDirectory;
    private final ReconciliationResultRepository reconciliationResultRepository;
    private final ReconciliationProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Reconcile an approved transaction's amount. Without budget linkage the result is unreconciled (no error).
     *
     * @throws ReconciliationException if the linked budget or category does not exist
     */
    public ReconciliationResult reconcile(StagedTransaction staged, String eventId) {
        if (!staged.hasBudgetLinkage()) {
            return ReconciliationResult.notReconciled(eventId, staged.getId(), "No budget linkage");
        }
        return apply(staged.getBudgetId(), staged.getBudgetCategoryId(), staged.getAmount(), eventId, staged.getId());
    }

    /**
     * Reconcile unless a result is already recorded for this event; the recorded result is returned then.
     */
    public ReconciliationResult reconcileIfAbsent(StagedTransaction staged, String eventId) {
        List<ReconciliationResult> recorded = reconciliationResultRepository.findByEventId(eventId);
        if (!recorded.isEmpty()) {
            log.debug("Event {} already reconciled; not applying it again", eventId);
            return recorded.get(0);
        }
        return reconcile(staged, eventId);
    }

    /**
     * Apply a signed adjustment (e.g. the amount difference of a correcting event) to a category.
     */
    public ReconciliationResult reconcileAdjustment(String budgetId, String categoryId, BigDecimal delta, String eventId) {
        return apply(budgetId, categoryId, delta, eventId, null);
    }

    /**
     * @return the budget holding the category
     * @throws ReconciliationException BUDGET_NOT_FOUND or CATEGORY_NOT_FOUND
     */
    public Budget requireCategory(String budgetId, String categoryId) {
        Budget budget = budgetDirectory.findBudget(budgetId)
                .orElseThrow(() -> new ReconciliationException(ReconciliationException.BUDGET_NOT_FOUND,
                        "Budget not found: " + budgetId));
        if (budget.findCategory(categoryId).isEmpty()) {
            throw categoryNotFound(budgetId, categoryId);
        }
        return budget;
    }

    /**
     * Reconcile each request independently; failures are logged and skipped.
     */
    public List<ReconciliationResult> reconcileMultiple(List<ReconciliationRequest> requests) {
        List<ReconciliationResult> results = new ArrayList<>();
        for (ReconciliationRequest request : requests) {
            try {
                results.add(reconcile(request.stagedTransaction(), request.eventId()));
            } catch (ReconciliationException e) {
                log.warn("Reconciliation failed for event {}: {}", request.eventId(), e.getMessage());
            }
        }
        return results;
    }

    public BudgetHealthStatus healthFor(BigDecimal totalActual, BigDecimal totalPlanned) {
        if (totalPlanned.signum() <= 0) {
            return totalActual.signum() > 0 ? BudgetHealthStatus.CRITICAL : BudgetHealthStatus.HEALTHY;
        }
        BigDecimal ratio = totalActual.divide(totalPlanned, MathContext.DECIMAL64);
        if (ratio.compareTo(properties.getWarningRatio()) <= 0) {
            return BudgetHealthStatus.HEALTHY;
        }
        if (ratio.compareTo(properties.getCriticalRatio()) <= 0) {
            return BudgetHealthStatus.WARNING;
        }
        return BudgetHealthStatus.CRITICAL;
    }

    private ReconciliationResult apply(String budgetId, String categoryId, BigDecimal amount, String eventId,
                                       String stagedTransactionId) {
        Budget before = requireCategory(budgetId, categoryId);
        Budget after = budgetDirectory.applyAmount(budgetId, categoryId, amount, eventId)
                .orElseThrow(() -> categoryNotFound(budgetId, categoryId));
        BudgetCategory category = after.findCategory(categoryId).orElseThrow(() -> categoryNotFound(budgetId, categoryId));

        BigDecimal planned = category.getPlanned();
        BigDecimal newActual = category.getActual();
        BigDecimal previousActual = newActual.subtract(amount);
        BigDecimal totalPlanned = after.totalPlanned();
        BigDecimal totalActual = after.totalActual();
        BudgetHealthStatus health = healthFor(totalActual, totalPlanned);
        Instant now = Instant.now();
        budgetDirectory.recordHealth(budgetId, health,
                new VariancePoint(now, totalPlanned, totalActual, totalActual.subtract(totalPlanned), health));

        ReconciliationResult result = new ReconciliationResult();
        result.setBudgetId(budgetId);
        result.setCategoryId(categoryId);
        result.setEventId(eventId);
        result.setStagedTransactionId(stagedTransactionId);
        result.setPreviousActual(previousActual);
        result.setNewActual(newActual);
        result.setAmountAdded(amount);
        result.setVarianceBeforeReconciliation(previousActual.subtract(planned));
        result.setVarianceAfterReconciliation(newActual.subtract(planned));
        result.setHealthStatus(health);
        result.setReconciled(true);
        result.setReconciledAt(now);
        result = reconciliationResultRepository.save(result);
        log.info("Reconciled event {} into {}/{}: actual {} -> {}, budget {}", eventId, budgetId, categoryId,
                previousActual.toPlainString(), newActual.toPlainString(), health);

        publishAlerts(before.getHealthStatus(), result, planned, totalActual.subtract(totalPlanned));
        return result;
    }

    private void publishAlerts(BudgetHealthStatus previousHealth, ReconciliationResult result, BigDecimal planned,
                               BigDecimal budgetVariance) {
        BigDecimal variance = result.getVarianceAfterReconciliation();
        if (planned.signum() > 0 && variance.signum() > 0) {
            BigDecimal percent = variance.multiply(HUNDRED).divide(planned, 2, RoundingMode.HALF_UP);
            BudgetVarianceAlertEvent.Severity severity = null;
            if (percent.compareTo(properties.getCategoryCriticalPercent()) > 0) {
                severity = BudgetVarianceAlertEvent.Severity.CRITICAL;
            } else if (percent.compareTo(properties.getCategoryWarningPercent()) > 0) {
                severity = BudgetVarianceAlertEvent.Severity.WARNING;
            }
            if (severity != null) {
                applicationEventPublisher.publishEvent(new BudgetVarianceAlertEvent(result.getBudgetId(),
                        result.getCategoryId(), severity, variance, percent, result.getHealthStatus(),
                        "Category over plan by " + percent.toPlainString() + "%"));
            }
        }
        BudgetHealthStatus health = result.getHealthStatus();
        if (health != previousHealth && health != BudgetHealthStatus.HEALTHY) {
            BudgetVarianceAlertEvent.Severity severity = health == BudgetHealthStatus.CRITICAL
                    ? BudgetVarianceAlertEvent.Severity.CRITICAL : BudgetVarianceAlertEvent.Severity.WARNING;
            applicationEventPublisher.publishEvent(new BudgetVarianceAlertEvent(result.getBudgetId(), null, severity,
                    budgetVariance, null, health, "Budget health changed from " + previousHealth + " to " + health));
        }
    }

    private static ReconciliationException categoryNotFound(String budgetId, String categoryId) {
        return new ReconciliationException(ReconciliationException.CATEGORY_NOT_FOUND,
                "Budget category not found: " + budgetId + "/" + categoryId);
    }
}
