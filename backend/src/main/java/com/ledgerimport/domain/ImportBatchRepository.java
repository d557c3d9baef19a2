package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for import_batches.
 */
public interface ImportBatchRepository extends MongoRepository<ImportBatch, String>, ImportBatchRepositoryCustom {

    List<ImportBatch> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    Optional<ImportBatch> findByBatchNumber(String batchNumber);

    /** Recovery: categorization dispatched but never completed nor abandoned. */
    List<ImportBatch> findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
            Instant dispatchedBefore, Collection<ImportBatchStatus> excludedStatuses);
}
