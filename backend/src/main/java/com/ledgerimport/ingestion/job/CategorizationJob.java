package com.ledgerimport.ingestion.job;

import com.ledgerimport.config.AsyncConfig;
import com.ledgerimport.domain.BatchStagedEvent;
import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ImportBatchStatus;
import com.ledgerimport.ingestion.categorization.BatchCategorizationService;
import com.ledgerimport.ingestion.progress.ImportProgressTracker;
import com.ledgerimport.ingestion.store.StagingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Background categorization of a staged batch on categorization-executor. Failures are logged and emitted on the
 * error stream; the batch stays reviewable with whatever was categorized.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategorizationJob {

    static final String STAGE = ImportBatchStatus.CATEGORIZING.stageName();

    private final StagingStore stagingStore;
    private final BatchCategorizationService batchCategorizationService;
    private final ImportProgressTracker progressTracker;

    @EventListener
    @Async(AsyncConfig.CATEGORIZATION_EXECUTOR)
    public void onBatchStaged(BatchStagedEvent event) {
        run(event.batchId());
    }

    public void run(String batchId) {
        try {
            ImportBatch batch = stagingStore.getBatch(batchId);
            if (batch.getStatus() == ImportBatchStatus.REJECTED) {
                log.debug("Batch {} rejected before categorization; skipping", batch.getBatchNumber());
                stagingStore.markCategorizationCompleted(batchId);
                return;
            }
            int applied = batchCategorizationService.categorizeBatch(batch);
            stagingStore.markCategorizationCompleted(batchId);
            progressTracker.report(batchId, STAGE, batch.getProgressPct(), "Categorized " + applied + " transactions");
        } catch (RuntimeException e) {
            log.warn("Categorization of batch {} failed: {}", batchId, e.getMessage(), e);
            progressTracker.reportError(batchId, STAGE, "Categorization failed: " + e.getMessage());
        }
    }
}
