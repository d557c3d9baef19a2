package com.ledgerimport.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed status updates for import_batches.
 */
@Repository
@RequiredArgsConstructor
public class ImportBatchRepositoryImpl implements ImportBatchRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean advanceStatus(String id, ImportBatchStatus target, int progressPct, String message) {
        Query query = new Query(where("_id").is(id).and("status").in(ImportBatchStatus.predecessorsOf(target)));
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", target)
                .set("progressPct", progressPct)
                .set("statusMessage", message)
                .set("updatedAt", now);
        if (target == ImportBatchStatus.COMPLETED) {
            update.set("completedAt", now);
        }
        return mongoTemplate.updateFirst(query, update, ImportBatch.class).getModifiedCount() == 1;
    }

    @Override
    public void updateProgress(String id, int progressPct, String message) {
        Update update = new Update()
                .set("progressPct", progressPct)
                .set("statusMessage", message)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(new Query(where("_id").is(id)), update, ImportBatch.class);
    }

    @Override
    public void recordFailure(String id, String stage, String message) {
        Update update = new Update()
                .set("failedStage", stage)
                .set("failureMessage", message)
                .set("statusMessage", "Failed during " + stage)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(new Query(where("_id").is(id)), update, ImportBatch.class);
    }

    @Override
    public void markCategorizationDispatched(String id) {
        Update update = new Update()
                .set("categorizationDispatchedAt", Instant.now())
                .inc("categorizationAttempts", 1)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(new Query(where("_id").is(id)), update, ImportBatch.class);
    }

    @Override
    public void markCategorizationCompleted(String id) {
        Update update = new Update()
                .set("categorizationCompletedAt", Instant.now())
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(new Query(where("_id").is(id).and("categorizationCompletedAt").is(null)),
                update, ImportBatch.class);
    }

    @Override
    public void markCategorizationAbandoned(String id, String message) {
        Update update = new Update()
                .set("categorizationAbandonedAt", Instant.now())
                .set("statusMessage", message)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(new Query(where("_id").is(id).and("categorizationCompletedAt").is(null)),
                update, ImportBatch.class);
    }

    @Override
    public boolean reject(String id, String reason) {
        Query query = new Query(where("_id").is(id)
                .and("status").in(ImportBatchStatus.predecessorsOf(ImportBatchStatus.REJECTED)));
        Instant now = Instant.now();
        Update update = new Update()
                .set("status", ImportBatchStatus.REJECTED)
                .set("rejectionReason", reason)
                .set("statusMessage", "Batch rejected")
                .set("updatedAt", now)
                .set("completedAt", now);
        return mongoTemplate.updateFirst(query, update, ImportBatch.class).getModifiedCount() == 1;
    }
}
