package com.ledgerimport.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional updates for staged_transactions.
 */
@Repository
@RequiredArgsConstructor
public class StagedTransactionRepositoryImpl implements StagedTransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<StagedTransaction> transitionReviewStatus(String id, ReviewStatus expected, ReviewStatus target, String note) {
        Criteria criteria = where("_id").is(id).and("reviewStatus").is(expected);
        if (target == ReviewStatus.APPROVED) {
            criteria = criteria.and("duplicate").ne(true);
        }
        Instant now = Instant.now();
        Update update = new Update()
                .set("reviewStatus", target)
                .set("reviewedAt", now)
                .set("updatedAt", now);
        if (note != null) {
            update.set("reviewNote", note);
        }
        StagedTransaction updated = mongoTemplate.findAndModify(new Query(criteria), update,
                FindAndModifyOptions.options().returnNew(true), StagedTransaction.class);
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean linkEconomicEvent(String id, String economicEventId) {
        Query query = new Query(where("_id").is(id)
                .and("reviewStatus").is(ReviewStatus.APPROVED)
                .and("economicEventId").is(null));
        Update update = new Update()
                .set("economicEventId", economicEventId)
                .set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, StagedTransaction.class).getModifiedCount() == 1;
    }

    @Override
    public boolean applyCategory(String id, CategoryAssignment assignment) {
        Query query = new Query(where("_id").is(id)
                .and("reviewStatus").is(ReviewStatus.PENDING)
                .and("categorySource").ne(CategorySource.MANUAL));
        Update update = new Update()
                .set("category", assignment.primary().category())
                .set("categoryConfidence", assignment.primary().confidence())
                .set("categorySource", assignment.source())
                .set("categoryReasoning", assignment.primary().reasoning())
                .set("suggestedCategories", assignment.alternatives())
                .set("appliedRuleId", assignment.ruleId())
                .set("updatedAt", Instant.now());
        if (assignment.budgetId() != null) {
            update.set("budgetId", assignment.budgetId());
            update.set("budgetCategoryId", assignment.budgetCategoryId());
        }
        return mongoTemplate.updateFirst(query, update, StagedTransaction.class).getModifiedCount() == 1;
    }

    @Override
    public Optional<StagedTransaction> applyManualCategory(String id, String category, String budgetId, String budgetCategoryId) {
        Query query = new Query(where("_id").is(id)
                .and("reviewStatus").in(List.of(ReviewStatus.PENDING, ReviewStatus.NEEDS_ATTENTION)));
        Update update = new Update()
                .set("category", category)
                .set("categoryConfidence", 100)
                .set("categorySource", CategorySource.MANUAL)
                .set("categoryReasoning", "Set by reviewer")
                .set("budgetId", budgetId)
                .set("budgetCategoryId", budgetCategoryId)
                .set("updatedAt", Instant.now());
        StagedTransaction updated = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), StagedTransaction.class);
        return Optional.ofNullable(updated);
    }

    @Override
    public long rejectPending(String batchId, String reason) {
        return rejectWhere(new Query(where("batchId").is(batchId).and("reviewStatus").is(ReviewStatus.PENDING)), reason);
    }

    @Override
    public long rejectUndecided(String batchId, String reason) {
        return rejectWhere(new Query(where("batchId").is(batchId)
                .and("reviewStatus").in(ReviewStatus.PENDING, ReviewStatus.NEEDS_ATTENTION)), reason);
    }

    private long rejectWhere(Query query, String reason) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("reviewStatus", ReviewStatus.REJECTED)
                .set("reviewNote", reason)
                .set("reviewedAt", now)
                .set("updatedAt", now);
        return mongoTemplate.updateMulti(query, update, StagedTransaction.class).getModifiedCount();
    }
}
