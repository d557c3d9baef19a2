package com.ledgerimport.ingestion.progress;

import java.time.Instant;

/**
 * Progress update for one batch: stage name, 0-100 percent, human-readable message.
 */
public record ImportProgress(String batchId, String stage, int percent, String message, Instant timestamp) {
}
