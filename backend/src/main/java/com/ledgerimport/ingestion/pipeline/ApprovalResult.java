package com.ledgerimport.ingestion.pipeline;

import com.ledgerimport.domain.ReconciliationResult;
import com.ledgerimport.domain.StagedTransaction;

/**
 * Outcome of approving one staged transaction.
 *
 * @param reconciliation null when the call was a no-op
 * @param alreadyApproved the transaction was approved by an earlier or concurrent call; nothing was created
 */
public record ApprovalResult(
        StagedTransaction transaction,
        String economicEventId,
        ReconciliationResult reconciliation,
        boolean alreadyApproved
) {
}
