package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Duplicate registry lookups, one per detection tier.
 */
public interface RegisteredTransactionRepository extends MongoRepository<RegisteredTransaction, String> {

    Optional<RegisteredTransaction> findByExternalTransactionId(String externalTransactionId);

    Optional<RegisteredTransaction> findFirstByFingerprint(String fingerprint);

    /** Fuzzy candidates: same account, date within [from, to] inclusive. Amount window is applied by the caller. */
    @Query("{ 'accountId': ?0, 'date': { $gte: ?1, $lte: ?2 } }")
    List<RegisteredTransaction> findCandidates(String accountId, LocalDate from, LocalDate to);

    long deleteByStagedTransactionIdIn(Collection<String> stagedTransactionIds);
}
