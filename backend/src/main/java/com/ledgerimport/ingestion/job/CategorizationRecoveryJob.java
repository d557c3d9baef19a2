package com.ledgerimport.ingestion.job;

import com.ledgerimport.domain.BatchStagedEvent;
import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ImportBatchRepository;
import com.ledgerimport.domain.ImportBatchStatus;
import com.ledgerimport.ingestion.config.CategorizationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Re-dispatches categorization that was dispatched but never completed (process restarted mid-run, or the run
 * failed). A batch that has used up its attempts is stamped abandoned and left for manual review.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategorizationRecoveryJob {

    private final ImportBatchRepository importBatchRepository;
    private final CategorizationProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Scheduled(fixedDelayString = "${ledgerimport.categorization.recovery-interval-ms:300000}")
    public void runScheduled() {
        redispatchStale();
    }

    /**
     * @return number of batches re-dispatched
     */
    public int redispatchStale() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getStaleAfterMinutes()));
        List<ImportBatch> stale = importBatchRepository
                .findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
                        cutoff, EnumSet.of(ImportBatchStatus.REJECTED, ImportBatchStatus.COMPLETED));
        int redispatched = 0;
        for (ImportBatch batch : stale) {
            if (batch.getCategorizationAttempts() >= properties.getMaxAttempts()) {
                log.warn("Giving up categorization for batch {} after {} attempt(s)", batch.getBatchNumber(),
                        batch.getCategorizationAttempts());
                importBatchRepository.markCategorizationAbandoned(batch.getId(),
                        "Categorization abandoned after " + batch.getCategorizationAttempts() + " attempts");
                continue;
            }
            log.info("Re-dispatching categorization for batch {} (dispatched {})", batch.getBatchNumber(),
                    batch.getCategorizationDispatchedAt());
            importBatchRepository.markCategorizationDispatched(batch.getId());
            applicationEventPublisher.publishEvent(new BatchStagedEvent(batch.getId(), batch.getOwnerId()));
            redispatched++;
        }
        return redispatched;
    }
}
