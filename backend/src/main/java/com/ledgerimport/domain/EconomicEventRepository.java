package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for economic_events. Events are inserted, never saved over; see {@link EconomicEventRepositoryCustom}.
 */
public interface EconomicEventRepository extends MongoRepository<EconomicEvent, String>, EconomicEventRepositoryCustom {

    Optional<EconomicEvent> findByStagedTransactionId(String stagedTransactionId);

    List<EconomicEvent> findByCorrectsEventId(String correctsEventId);
}
