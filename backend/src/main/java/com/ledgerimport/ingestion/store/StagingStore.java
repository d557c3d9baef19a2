package com.ledgerimport.ingestion.store;

import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ImportBatchRepository;
import com.ledgerimport.domain.ReviewStatus;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.domain.StagedTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Store of import batches and staged transactions. Review status changes are conditional single-document updates,
 * so a status is decided at most once.
 */
@Service
@RequiredArgsConstructor
public class StagingStore {

    private static final String BATCH_NUMBER_PREFIX = "IB-";

    private final ImportBatchRepository importBatchRepository;
    private final StagedTransactionRepository stagedTransactionRepository;

    public ImportBatch createBatch(ImportBatch batch) {
        Instant now = Instant.now();
        batch.setBatchNumber(newBatchNumber());
        batch.setCreatedAt(now);
        batch.setUpdatedAt(now);
        return importBatchRepository.insert(batch);
    }

    public ImportBatch saveBatch(ImportBatch batch) {
        batch.setUpdatedAt(Instant.now());
        return importBatchRepository.save(batch);
    }

    /** Single bulk insert of a batch's staged transactions. */
    public List<StagedTransaction> stageAll(List<StagedTransaction> transactions) {
        if (transactions.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(stagedTransactionRepository.insert(transactions));
    }

    public ImportBatch getBatch(String batchId) {
        return importBatchRepository.findById(batchId)
                .orElseThrow(() -> new StagedTransactionException(StagedTransactionException.BATCH_NOT_FOUND,
                        "Import batch not found: " + batchId));
    }

    public List<ImportBatch> getBatchesForOwner(String ownerId) {
        return importBatchRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    public void markCategorizationDispatched(String batchId) {
        importBatchRepository.markCategorizationDispatched(batchId);
    }

    public void markCategorizationCompleted(String batchId) {
        importBatchRepository.markCategorizationCompleted(batchId);
    }

    /**
     * @return false if the batch is already terminal
     */
    public boolean rejectBatch(String batchId, String reason) {
        return importBatchRepository.reject(batchId, reason);
    }

    public StagedTransaction getStaged(String id) {
        return stagedTransactionRepository.findById(id)
                .orElseThrow(() -> new StagedTransactionException(StagedTransactionException.STAGED_NOT_FOUND,
                        "Staged transaction not found: " + id));
    }

    public List<StagedTransaction> getStagedForBatch(String batchId) {
        return stagedTransactionRepository.findByBatchIdOrderByTimestampAsc(batchId);
    }

    public Optional<StagedTransaction> transition(String id, ReviewStatus from, ReviewStatus to, String note) {
        return stagedTransactionRepository.transitionReviewStatus(id, from, to, note);
    }

    public Optional<StagedTransaction> applyManualCategory(String id, String category, String budgetId, String budgetCategoryId) {
        return stagedTransactionRepository.applyManualCategory(id, category, budgetId, budgetCategoryId);
    }

    public boolean linkEvent(String id, String economicEventId) {
        return stagedTransactionRepository.linkEconomicEvent(id, economicEventId);
    }

    public long rejectPending(String batchId, String reason) {
        return stagedTransactionRepository.rejectPending(batchId, reason);
    }

    /** Discard what a failed import left behind: every item not yet approved or rejected. */
    public long rejectUndecided(String batchId, String reason) {
        return stagedTransactionRepository.rejectUndecided(batchId, reason);
    }

    public long countPending(String batchId) {
        return stagedTransactionRepository.countByBatchIdAndReviewStatus(batchId, ReviewStatus.PENDING);
    }

    static String newBatchNumber() {
        String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return BATCH_NUMBER_PREFIX + hex.toUpperCase(Locale.ROOT);
    }
}
