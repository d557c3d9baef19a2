package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ReconciliationResultRepository extends MongoRepository<ReconciliationResult, String> {

    List<ReconciliationResult> findByBudgetIdOrderByReconciledAtDesc(String budgetId);

    List<ReconciliationResult> findByEventId(String eventId);
}
