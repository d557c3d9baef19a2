package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit record of applying one event amount to a budget category. Unreconciled results (no linkage) are returned
 * to the caller but not stored.
 */
@Document(collection = "reconciliations")
@CompoundIndex(name = "budget_category_time", def = "{'budgetId': 1, 'categoryId': 1, 'reconciledAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ReconciliationResult {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String budgetId;
    private String categoryId;
    private String eventId;
    private String stagedTransactionId;
    private BigDecimal previousActual;
    private BigDecimal newActual;
    private BigDecimal amountAdded;
    private BigDecimal varianceBeforeReconciliation;
    private BigDecimal varianceAfterReconciliation;
    private BudgetHealthStatus healthStatus;
    private boolean reconciled;
    private String message;
    private Instant reconciledAt;

    public static ReconciliationResult notReconciled(String eventId, String stagedTransactionId, String message) {
        ReconciliationResult r = new ReconciliationResult();
        r.setEventId(eventId);
        r.setStagedTransactionId(stagedTransactionId);
        r.setReconciled(false);
        r.setMessage(message);
        r.setReconciledAt(Instant.now());
        return r;
    }
}
