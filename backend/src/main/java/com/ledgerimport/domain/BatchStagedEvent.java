package com.ledgerimport.domain;

/**
 * Application event: a batch has been staged and is ready for background categorization.
 */
public record BatchStagedEvent(String batchId, String ownerId) {
}
