package com.ledgerimport.domain;

import lombok.RequiredArgsConstructor;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed $inc on embedded budget categories (positional operator).
 */
@Repository
@RequiredArgsConstructor
public class BudgetRepositoryImpl implements BudgetRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Budget> incrementCategoryActual(String budgetId, String categoryId, BigDecimal amount, String eventId) {
        Query query = new Query(where("_id").is(budgetId).and("categories.categoryId").is(categoryId));
        Update update = new Update()
                .inc("categories.$.actual", new Decimal128(amount))
                .addToSet("categories.$.linkedEventIds", eventId);
        Budget updated = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Budget.class);
        return Optional.ofNullable(updated);
    }

    @Override
    public void recordHealth(String budgetId, BudgetHealthStatus healthStatus, VariancePoint point, int trendLength) {
        Update update = new Update()
                .set("healthStatus", healthStatus)
                .set("lastReconciledAt", point.getAt());
        update.push("varianceTrend").slice(-trendLength).each(point);
        mongoTemplate.updateFirst(new Query(where("_id").is(budgetId)), update, Budget.class);
    }
}
