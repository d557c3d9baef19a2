package com.ledgerimport.ingestion.pipeline;

import java.util.List;

/**
 * Per-item outcome of a bulk approval. Successes are kept even when other items fail.
 */
public record BulkApprovalResult(int approved, int alreadyApproved, List<Failure> failures) {

    public BulkApprovalResult {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public record Failure(String stagedTransactionId, String errorCode, String message) {
    }
}
