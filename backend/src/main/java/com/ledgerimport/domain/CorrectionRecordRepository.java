package com.ledgerimport.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for correction_records.
 */
public interface CorrectionRecordRepository extends MongoRepository<CorrectionRecord, String> {

    List<CorrectionRecord> findByMerchantKey(String merchantKey);

    /** Most recent first; few-shot examples for the external classifier. */
    List<CorrectionRecord> findByOwnerIdOrderByCorrectedAtDesc(String ownerId, Pageable pageable);
}
