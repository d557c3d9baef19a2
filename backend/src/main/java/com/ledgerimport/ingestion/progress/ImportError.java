package com.ledgerimport.ingestion.progress;

import java.time.Instant;

/**
 * Error reported on the error stream, tagged with the stage it happened in. {@code batchId} is null for
 * operations spanning batches (bulk approval).
 */
public record ImportError(String batchId, String stage, String message, Instant timestamp) {
}
