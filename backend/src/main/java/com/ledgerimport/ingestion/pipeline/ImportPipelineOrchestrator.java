package com.ledgerimport.ingestion.pipeline;

import com.ledgerimport.domain.AggregatorConnection;
import com.ledgerimport.domain.BatchStagedEvent;
import com.ledgerimport.domain.ExternalTransaction;
import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ImportBatchStatus;
import com.ledgerimport.domain.ReviewStatus;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.ingestion.adapter.AggregatorException;
import com.ledgerimport.ingestion.adapter.TransactionAggregator;
import com.ledgerimport.ingestion.config.AggregatorProperties;
import com.ledgerimport.ingestion.dedup.DuplicateDetector;
import com.ledgerimport.ingestion.dedup.DuplicatePartition;
import com.ledgerimport.ingestion.normalizer.NormalizationResult;
import com.ledgerimport.ingestion.normalizer.NormalizedTransaction;
import com.ledgerimport.ingestion.normalizer.TransactionNormalizer;
import com.ledgerimport.ingestion.progress.ImportProgressTracker;
import com.ledgerimport.ingestion.store.ConnectionDirectory;
import com.ledgerimport.ingestion.store.StagingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Runs an import: fetch, normalize, deduplicate, stage, dispatch categorization, hand over for review.
 *
 * <p>Each stage advances the batch and publishes progress. A failing stage is recorded on the batch and emitted on
 * the error stream, and the exception propagates to the caller. Before staging the batch stays at the stage it
 * reached. From staging on the run is abandoned instead: whatever it staged is rejected, its registry entries are
 * removed and the batch is REJECTED, so a retry starts from a clean slate. Categorization runs in the background and
 * never fails the run.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportPipelineOrchestrator {

    private final ConnectionDirectory connectionDirectory;
    private final TransactionAggregator transactionAggregator;
    private final TransactionNormalizer transactionNormalizer;
    private final DuplicateDetector duplicateDetector;
    private final StagingStore stagingStore;
    private final ImportProgressTracker progressTracker;
    private final StagedTransactionReviewService reviewService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final AggregatorProperties aggregatorProperties;

    /**
     * @return the batch as persisted after the run: REVIEWING, or COMPLETED when nothing needs review
     * @throws ImportPipelineException CONNECTION_NOT_FOUND, FETCH_FAILED or STAGING_FAILED
     */
    public ImportBatch executeImport(ImportRequest request) {
        ImportBatch batch = stagingStore.createBatch(newBatch(request));
        String batchId = batch.getId();
        log.info("Import {} started for owner {} ({} to {})", batch.getBatchNumber(), request.ownerId(),
                request.dateRange().start(), request.dateRange().end());

        ImportBatchStatus stage = ImportBatchStatus.FETCHING;
        try {
            progressTracker.advance(batchId, stage, 10, "Fetching transactions");
            List<ExternalTransaction> fetched = fetch(request, batchId);
            if (fetched.isEmpty()) {
                progressTracker.advance(batchId, ImportBatchStatus.COMPLETED, 100, "No transactions to import");
                log.info("Import {}: nothing to import", batch.getBatchNumber());
                return stagingStore.getBatch(batchId);
            }

            stage = ImportBatchStatus.NORMALIZING;
            progressTracker.advance(batchId, stage, 25, "Normalizing " + fetched.size() + " transactions");
            NormalizationResult normalized = transactionNormalizer.normalizeAll(fetched);

            stage = ImportBatchStatus.DEDUPLICATING;
            progressTracker.advance(batchId, stage, 40, "Detecting duplicates");
            DuplicatePartition partition = request.skipDuplicateCheck()
                    ? new DuplicatePartition(normalized.transactions(), List.of())
                    : duplicateDetector.partition(normalized.transactions());

            stage = ImportBatchStatus.STAGING;
            boolean flagDuplicates = request.duplicateHandling() == ImportRequest.DuplicateHandling.FLAG;
            int toStage = partition.unique().size() + (flagDuplicates ? partition.duplicates().size() : 0);
            progressTracker.advance(batchId, stage, 60, "Creating " + toStage + " staged transactions");
            List<StagedTransaction> staged = stage(batch, partition, flagDuplicates);
            ImportBatch current = stagingStore.getBatch(batchId);
            current.setTotalTransactions(partition.total());
            current.setNewTransactions(partition.unique().size());
            current.setDuplicateTransactions(partition.duplicates().size());
            current.setErrorTransactions(normalized.errorCount());
            current.setStagedTransactionIds(staged.stream().map(StagedTransaction::getId).toList());
            current.setCategorizationEnabled(request.categorize());
            stagingStore.saveBatch(current);

            if (request.categorize() && !staged.isEmpty()) {
                stage = ImportBatchStatus.CATEGORIZING;
                progressTracker.advance(batchId, stage, 70, "Categorizing in background");
                stagingStore.markCategorizationDispatched(batchId);
                applicationEventPublisher.publishEvent(new BatchStagedEvent(batchId, request.ownerId()));
            }

            stage = ImportBatchStatus.REVIEWING;
            progressTracker.advance(batchId, stage, 85, "Ready for review: " + staged.size() + " transactions");
            reviewService.completeIfDecided(batchId);
            log.info("Import {}: {} fetched, {} new, {} duplicate, {} malformed", batch.getBatchNumber(),
                    fetched.size(), partition.unique().size(), partition.duplicates().size(), normalized.errorCount());
            return stagingStore.getBatch(batchId);
        } catch (RuntimeException e) {
            progressTracker.stageFailed(batchId, stage.stageName(), e.getMessage());
            log.error("Import {} failed during {}", batch.getBatchNumber(), stage.stageName(), e);
            if (stage.compareTo(ImportBatchStatus.STAGING) >= 0) {
                discardStaged(batch, stage, e);
            }
            throw e;
        }
    }

    public ImportBatch getBatch(String batchId) {
        return stagingStore.getBatch(batchId);
    }

    public List<ImportBatch> getBatchesForOwner(String ownerId) {
        return stagingStore.getBatchesForOwner(ownerId);
    }

    public List<StagedTransaction> getStagedTransactionsForBatch(String batchId) {
        stagingStore.getBatch(batchId);
        return stagingStore.getStagedForBatch(batchId);
    }

    private void discardStaged(ImportBatch batch, ImportBatchStatus failedStage, RuntimeException cause) {
        String batchId = batch.getId();
        String reason = "Import failed during " + failedStage.stageName() + ": " + cause.getMessage();
        try {
            List<String> stagedIds = stagingStore.getStagedForBatch(batchId).stream().map(StagedTransaction::getId).toList();
            long rejected = stagingStore.rejectUndecided(batchId, reason);
            long unregistered = duplicateDetector.unregister(stagedIds);
            stagingStore.rejectBatch(batchId, reason);
            log.warn("Import {}: discarded {} staged transaction(s) and {} registry entries", batch.getBatchNumber(),
                    rejected, unregistered);
        } catch (RuntimeException cleanupFailure) {
            log.error("Import {}: could not discard staged transactions", batch.getBatchNumber(), cleanupFailure);
            cause.addSuppressed(cleanupFailure);
        }
    }

    private List<ExternalTransaction> fetch(ImportRequest request, String batchId) {
        AggregatorConnection connection = connectionDirectory.findConnection(request.connectionId())
                .filter(c -> request.ownerId().equals(c.getOwnerId()))
                .orElseThrow(() -> new ImportPipelineException(ImportPipelineException.CONNECTION_NOT_FOUND, batchId,
                        "Connection not found: " + request.connectionId()));
        if (connection.getStatus() != null && connection.getStatus() != AggregatorConnection.ConnectionStatus.ACTIVE) {
            throw new ImportPipelineException(ImportPipelineException.FETCH_FAILED, batchId,
                    "Connection " + connection.getId() + " is " + connection.getStatus());
        }
        Duration deadline = request.fetchTimeout() != null
                ? request.fetchTimeout()
                : Duration.ofMillis(aggregatorProperties.getFetchTimeoutMs());
        List<ExternalTransaction> fetched;
        try {
            fetched = transactionAggregator.fetch(connection, request.dateRange(), deadline);
        } catch (AggregatorException e) {
            throw new ImportPipelineException(ImportPipelineException.FETCH_FAILED, batchId,
                    "Fetch failed: " + e.getMessage(), e);
        }
        if (fetched == null) {
            return List.of();
        }
        if (request.accountIds().isEmpty()) {
            return fetched;
        }
        return fetched.stream().filter(t -> t.accountId() != null && request.accountIds().contains(t.accountId())).toList();
    }

    private List<StagedTransaction> stage(ImportBatch batch, DuplicatePartition partition, boolean flagDuplicates) {
        List<NormalizedTransaction> sources = new ArrayList<>(partition.unique());
        List<StagedTransaction> toInsert = new ArrayList<>();
        for (NormalizedTransaction txn : partition.unique()) {
            toInsert.add(toStaged(txn, batch));
        }
        if (flagDuplicates) {
            for (DuplicatePartition.Flagged flagged : partition.duplicates()) {
                StagedTransaction s = toStaged(flagged.transaction(), batch);
                s.setDuplicate(true);
                s.setDuplicateOfTransactionId(flagged.result().matchedTransactionId());
                s.setDuplicateConfidence(flagged.result().confidence());
                toInsert.add(s);
            }
        }
        List<StagedTransaction> staged;
        try {
            staged = stagingStore.stageAll(toInsert);
        } catch (RuntimeException e) {
            throw new ImportPipelineException(ImportPipelineException.STAGING_FAILED, batch.getId(),
                    "Could not stage transactions: " + e.getMessage(), e);
        }
        for (int i = 0; i < sources.size(); i++) {
            duplicateDetector.register(sources.get(i), staged.get(i).getId());
        }
        for (int i = sources.size(); i < staged.size(); i++) {
            StagedTransaction duplicate = staged.get(i);
            stagingStore.transition(duplicate.getId(), ReviewStatus.PENDING, ReviewStatus.NEEDS_ATTENTION,
                    "Suspected duplicate of " + duplicate.getDuplicateOfTransactionId());
        }
        return staged;
    }

    private static StagedTransaction toStaged(NormalizedTransaction txn, ImportBatch batch) {
        Instant now = Instant.now();
        StagedTransaction s = new StagedTransaction();
        s.setBatchId(batch.getId());
        s.setOwnerId(batch.getOwnerId());
        s.setExternalTransactionId(txn.externalTransactionId());
        s.setExternalAccountId(txn.accountId());
        s.setTimestamp(txn.timestamp());
        s.setKind(txn.kind());
        s.setAmount(txn.amount());
        s.setCurrency(txn.currency());
        s.setDescription(txn.description());
        s.setMerchantName(txn.merchantName());
        s.setReviewStatus(ReviewStatus.PENDING);
        s.setRawPayload(txn.rawPayload() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(txn.rawPayload()));
        s.setCreatedAt(now);
        s.setUpdatedAt(now);
        return s;
    }

    private static ImportBatch newBatch(ImportRequest request) {
        ImportBatch batch = new ImportBatch();
        batch.setOwnerId(request.ownerId());
        batch.setConnectionId(request.connectionId());
        batch.setAccountIds(new ArrayList<>(request.accountIds()));
        batch.setStartDate(request.dateRange().start());
        batch.setEndDate(request.dateRange().end());
        batch.setStatus(ImportBatchStatus.CREATED);
        batch.setCategorizationEnabled(request.categorize());
        return batch;
    }
}
