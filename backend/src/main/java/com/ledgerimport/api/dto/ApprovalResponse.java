package com.ledgerimport.api.dto;

import com.ledgerimport.domain.BudgetHealthStatus;
import com.ledgerimport.domain.ReconciliationResult;
import com.ledgerimport.ingestion.pipeline.ApprovalResult;

import java.math.BigDecimal;

/**
 * Result of approving one staged transaction. Budget fields are null when nothing was reconciled.
 */
public record ApprovalResponse(
        String stagedTransactionId,
        String economicEventId,
        boolean alreadyApproved,
        boolean reconciled,
        String budgetId,
        String budgetCategoryId,
        BigDecimal newActual,
        BigDecimal varianceAfterReconciliation,
        BudgetHealthStatus budgetHealth
) {

    public static ApprovalResponse from(ApprovalResult result) {
        ReconciliationResult r = result.reconciliation();
        boolean reconciled = r != null && r.isReconciled();
        return new ApprovalResponse(
                result.transaction().getId(),
                result.economicEventId(),
                result.alreadyApproved(),
                reconciled,
                reconciled ? r.getBudgetId() : null,
                reconciled ? r.getCategoryId() : null,
                reconciled ? r.getNewActual() : null,
                reconciled ? r.getVarianceAfterReconciliation() : null,
                reconciled ? r.getHealthStatus() : null);
    }
}
