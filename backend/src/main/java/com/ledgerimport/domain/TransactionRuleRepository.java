package com.ledgerimport.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TransactionRuleRepository extends MongoRepository<TransactionRule, String>, TransactionRuleRepositoryCustom {

    List<TransactionRule> findByOwnerIdAndEnabledTrueOrderByPriorityDesc(String ownerId);
}
