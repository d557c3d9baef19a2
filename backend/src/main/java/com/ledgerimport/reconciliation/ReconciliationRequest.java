package com.ledgerimport.reconciliation;

import com.ledgerimport.domain.StagedTransaction;

/**
 * A staged transaction paired with the event created from it.
 */
public record ReconciliationRequest(StagedTransaction stagedTransaction, String eventId) {
}
