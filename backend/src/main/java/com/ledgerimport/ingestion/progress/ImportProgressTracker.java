package com.ledgerimport.ingestion.progress;

import com.ledgerimport.domain.ImportBatchRepository;
import com.ledgerimport.domain.ImportBatchStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;

/**
 * Persists batch stage/progress on import_batches and publishes it on two hot streams: progress (latest update
 * replayed to new subscribers) and errors (live only).
 */
@Component
@Slf4j
public class ImportProgressTracker {

    private final ImportBatchRepository importBatchRepository;
    private final Sinks.Many<ImportProgress> progressSink = Sinks.many().replay().latest();
    private final Sinks.Many<ImportError> errorSink = Sinks.many().multicast().directBestEffort();

    public ImportProgressTracker(ImportBatchRepository importBatchRepository) {
        this.importBatchRepository = importBatchRepository;
    }

    /**
     * Move the batch forward to {@code status}. A move to the current or an earlier stage is ignored.
     *
     * @return true if the batch moved
     */
    public boolean advance(String batchId, ImportBatchStatus status, int percent, String message) {
        boolean moved = importBatchRepository.advanceStatus(batchId, status, percent, message);
        if (moved) {
            log.debug("Batch {} -> {} ({}%): {}", batchId, status, percent, message);
            emitProgress(new ImportProgress(batchId, status.stageName(), percent, message, Instant.now()));
        }
        return moved;
    }

    /** Informational progress without a stage change. */
    public void report(String batchId, String stage, int percent, String message) {
        importBatchRepository.updateProgress(batchId, percent, message);
        emitProgress(new ImportProgress(batchId, stage, percent, message, Instant.now()));
    }

    /**
     * A stage failed: record it on the batch (status is left at the last successful stage) and emit an error
     * plus a terminal ERROR progress update.
     */
    public void stageFailed(String batchId, String stage, String message) {
        importBatchRepository.recordFailure(batchId, stage, message);
        emitError(new ImportError(batchId, stage, message, Instant.now()));
        emitProgress(new ImportProgress(batchId, ImportBatchStatus.ERROR.stageName(), 0, message, Instant.now()));
    }

    /** Non-fatal error: emitted only, batch untouched. */
    public void reportError(String batchId, String stage, String message) {
        emitError(new ImportError(batchId, stage, message, Instant.now()));
    }

    public Flux<ImportProgress> progressStream() {
        return progressSink.asFlux();
    }

    public Flux<ImportError> errorStream() {
        return errorSink.asFlux();
    }

    private synchronized void emitProgress(ImportProgress progress) {
        Sinks.EmitResult result = progressSink.tryEmitNext(progress);
        if (result.isFailure()) {
            log.debug("Progress update for batch {} not emitted: {}", progress.batchId(), result);
        }
    }

    private synchronized void emitError(ImportError error) {
        Sinks.EmitResult result = errorSink.tryEmitNext(error);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Error event for batch {} not emitted: {}", error.batchId(), result);
        }
    }
}
