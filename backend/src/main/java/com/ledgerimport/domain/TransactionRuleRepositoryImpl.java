package com.ledgerimport.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class TransactionRuleRepositoryImpl implements TransactionRuleRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void incrementAppliedCount(String ruleId) {
        mongoTemplate.updateFirst(new Query(where("_id").is(ruleId)), new Update().inc("appliedCount", 1), TransactionRule.class);
    }

    @Override
    public void incrementCorrectCount(String ruleId) {
        mongoTemplate.updateFirst(new Query(where("_id").is(ruleId)), new Update().inc("correctCount", 1), TransactionRule.class);
    }
}
