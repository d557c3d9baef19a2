package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for budgets. Actual amounts change only via {@link BudgetRepositoryCustom#incrementCategoryActual}.
 */
public interface BudgetRepository extends MongoRepository<Budget, String>, BudgetRepositoryCustom {

    List<Budget> findByOwnerId(String ownerId);
}
