package com.ledgerimport.domain;

import java.util.Optional;

/**
 * Conditional updates on staged_transactions. Each is a single-document atomic operation; a false/empty result means
 * the precondition no longer held.
 */
public interface StagedTransactionRepositoryCustom {

    /**
     * Move review status from {@code expected} to {@code target}. A move to APPROVED also requires duplicate == false.
     *
     * @return the updated document, or empty if the status was not {@code expected} (or the item is a duplicate)
     */
    Optional<StagedTransaction> transitionReviewStatus(String id, ReviewStatus expected, ReviewStatus target, String note);

    /** Set economicEventId if still unset and the item is APPROVED. */
    boolean linkEconomicEvent(String id, String economicEventId);

    /** Apply a machine category unless a human already set one. */
    boolean applyCategory(String id, CategoryAssignment assignment);

    /** Human category change; allowed while the item is undecided or needs attention. */
    Optional<StagedTransaction> applyManualCategory(String id, String category, String budgetId, String budgetCategoryId);

    /** Reject every PENDING item of a batch; returns the number rejected. */
    long rejectPending(String batchId, String reason);

    /** Reject every PENDING or NEEDS_ATTENTION item of a batch; approved and rejected items are left alone. */
    long rejectUndecided(String batchId, String reason);
}
