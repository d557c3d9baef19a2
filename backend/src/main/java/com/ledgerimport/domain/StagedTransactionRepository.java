package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for staged_transactions. Status and linkage changes go through {@link StagedTransactionRepositoryCustom}.
 */
public interface StagedTransactionRepository extends MongoRepository<StagedTransaction, String>, StagedTransactionRepositoryCustom {

    List<StagedTransaction> findByBatchIdOrderByTimestampAsc(String batchId);

    List<StagedTransaction> findByBatchIdAndReviewStatusAndCategorySourceNot(String batchId, ReviewStatus reviewStatus,
                                                                             CategorySource categorySource);

    long countByBatchIdAndReviewStatus(String batchId, ReviewStatus reviewStatus);

    List<StagedTransaction> findByIdIn(Collection<String> ids);
}
