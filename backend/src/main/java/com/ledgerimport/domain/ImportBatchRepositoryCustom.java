package com.ledgerimport.domain;

/**
 * Forward-only status moves and progress bookkeeping for import_batches.
 */
public interface ImportBatchRepositoryCustom {

    /**
     * Move the batch to {@code target} if it is currently in an earlier non-terminal stage.
     *
     * @return true if the status changed
     */
    boolean advanceStatus(String id, ImportBatchStatus target, int progressPct, String message);

    /** Progress within the current stage; status untouched. */
    void updateProgress(String id, int progressPct, String message);

    /** Record a failed stage; status stays at the last successful stage. */
    void recordFailure(String id, String stage, String message);

    /** Stamp the dispatch time and count the attempt. */
    void markCategorizationDispatched(String id);

    void markCategorizationCompleted(String id);

    /** Stop recovery for a batch whose categorization never completes. No-op once completed. */
    void markCategorizationAbandoned(String id, String message);

    /** Move to REJECTED from any non-terminal stage. */
    boolean reject(String id, String reason);
}
