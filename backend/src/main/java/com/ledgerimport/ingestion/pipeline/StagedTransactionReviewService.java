package com.ledgerimport.ingestion.pipeline;

import com.ledgerimport.domain.CategorySource;
import com.ledgerimport.domain.EconomicEvent;
import com.ledgerimport.domain.EconomicEventRepository;
import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ImportBatchStatus;
import com.ledgerimport.domain.ReconciliationResult;
import com.ledgerimport.domain.ReviewStatus;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.domain.TransactionRuleRepository;
import com.ledgerimport.ingestion.categorization.CorrectionLearner;
import com.ledgerimport.ingestion.progress.ImportProgressTracker;
import com.ledgerimport.ingestion.store.StagedTransactionException;
import com.ledgerimport.ingestion.store.StagingStore;
import com.ledgerimport.ledger.EconomicEventException;
import com.ledgerimport.ledger.EconomicEventFactory;
import com.ledgerimport.reconciliation.BudgetReconciler;
import com.ledgerimport.reconciliation.ReconciliationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Human review of staged transactions: approve (create the ledger event and reconcile the budget), reject, flag,
 * re-categorize, and reject a whole batch.
 *
 * <p>Approval is at-most-once per staged transaction: the PENDING to APPROVED claim is a conditional update, event
 * creation is guarded by a unique index and the event link by a conditional update. Approving an approved
 * transaction is a no-op. A transaction left APPROVED without an event (process stopped mid-approval) gets its
 * event on the next approve call; one whose event exists but was never linked gets the link and, if missing, its
 * reconciliation.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StagedTransactionReviewService {

    static final String APPROVAL_STAGE = "approval";
    static final String BULK_APPROVAL_STAGE = "bulk-approval";
    private static final Set<ImportBatchStatus> COMPLETABLE = EnumSet.of(ImportBatchStatus.REVIEWING, ImportBatchStatus.APPROVING);

    private final StagingStore stagingStore;
    private final EconomicEventFactory economicEventFactory;
    private final EconomicEventRepository economicEventRepository;
    private final BudgetReconciler budgetReconciler;
    private final TransactionRuleRepository transactionRuleRepository;
    private final CorrectionLearner correctionLearner;
    private final ImportProgressTracker progressTracker;

    /**
     * @throws StagedTransactionException STAGED_NOT_FOUND, DUPLICATE_NOT_APPROVABLE, or INVALID_REVIEW_TRANSITION
     *                                    when the transaction was rejected or flagged
     * @throws EconomicEventException     EVENT_ALREADY_CREATED when an event exists that this call cannot account for
     * @throws ReconciliationException    the linked budget or category does not exist; the event stays created
     */
    public ApprovalResult approveTransaction(String stagedTransactionId) {
        StagedTransaction staged = stagingStore.getStaged(stagedTransactionId);
        if (staged.isDuplicate()) {
            throw new StagedTransactionException(StagedTransactionException.DUPLICATE_NOT_APPROVABLE,
                    "Transaction " + stagedTransactionId + " is a suspected duplicate of "
                            + staged.getDuplicateOfTransactionId() + " and cannot be approved");
        }
        if (staged.getReviewStatus() == ReviewStatus.APPROVED) {
            return resume(staged);
        }
        if (staged.getReviewStatus() != ReviewStatus.PENDING) {
            throw invalidTransition(staged, ReviewStatus.APPROVED);
        }
        Optional<StagedTransaction> claimed = stagingStore.transition(stagedTransactionId, ReviewStatus.PENDING,
                ReviewStatus.APPROVED, null);
        if (claimed.isEmpty()) {
            StagedTransaction current = stagingStore.getStaged(stagedTransactionId);
            if (current.getReviewStatus() == ReviewStatus.APPROVED) {
                log.debug("Transaction {} approved concurrently", stagedTransactionId);
                return new ApprovalResult(current, current.getEconomicEventId(), null, true);
            }
            throw invalidTransition(current, ReviewStatus.APPROVED);
        }
        return createAndReconcile(claimed.get(), false);
    }

    /**
     * Approve each id independently. Failures are collected; earlier successes are kept.
     */
    public BulkApprovalResult approveBatch(List<String> stagedTransactionIds) {
        int approved = 0;
        int alreadyApproved = 0;
        List<BulkApprovalResult.Failure> failures = new ArrayList<>();
        for (String id : new LinkedHashSet<>(stagedTransactionIds)) {
            try {
                ApprovalResult result = approveTransaction(id);
                if (result.alreadyApproved()) {
                    alreadyApproved++;
                } else {
                    approved++;
                }
            } catch (RuntimeException e) {
                log.warn("Bulk approval: transaction {} failed: {}", id, e.getMessage());
                failures.add(new BulkApprovalResult.Failure(id, errorCodeOf(e), e.getMessage()));
            }
        }
        if (!failures.isEmpty()) {
            progressTracker.reportError(null, BULK_APPROVAL_STAGE, failures.size() + " transactions failed to approve");
        }
        log.info("Bulk approval of {} id(s): {} approved, {} already approved, {} failed",
                stagedTransactionIds.size(), approved, alreadyApproved, failures.size());
        return new BulkApprovalResult(approved, alreadyApproved, failures);
    }

    /**
     * Rejecting a rejected transaction returns it unchanged.
     */
    public StagedTransaction rejectTransaction(String stagedTransactionId, String reason) {
        return decide(stagedTransactionId, ReviewStatus.REJECTED, reason);
    }

    /** PENDING to NEEDS_ATTENTION. */
    public StagedTransaction flagTransaction(String stagedTransactionId, String note) {
        return decide(stagedTransactionId, ReviewStatus.NEEDS_ATTENTION, note);
    }

    /**
     * Reviewer assigns a category. When it overrides a machine-assigned category the correction is recorded for
     * learning.
     */
    public StagedTransaction updateCategory(String stagedTransactionId, String category, String budgetId,
                                            String budgetCategoryId, String reason) {
        StagedTransaction before = stagingStore.getStaged(stagedTransactionId);
        StagedTransaction updated = stagingStore.applyManualCategory(stagedTransactionId, category, budgetId, budgetCategoryId)
                .orElseThrow(() -> new StagedTransactionException(StagedTransactionException.INVALID_REVIEW_TRANSITION,
                        "Category of transaction " + stagedTransactionId + " can no longer be changed ("
                                + before.getReviewStatus() + ")"));
        if (overridesMachineCategory(before, category)) {
            correctionLearner.recordCorrection(before, category, reason);
        }
        return updated;
    }

    /**
     * Reject the batch and every transaction still pending in it. Decided transactions keep their status.
     */
    public ImportBatch rejectBatch(String batchId, String reason) {
        ImportBatch batch = stagingStore.getBatch(batchId);
        if (!stagingStore.rejectBatch(batchId, reason)) {
            throw new StagedTransactionException(StagedTransactionException.INVALID_REVIEW_TRANSITION,
                    "Batch " + batch.getBatchNumber() + " is already " + batch.getStatus());
        }
        long rejected = stagingStore.rejectPending(batchId, reason);
        progressTracker.report(batchId, ImportBatchStatus.REJECTED.stageName(), 100,
                "Batch rejected; " + rejected + " pending transaction(s) rejected");
        log.info("Batch {} rejected ({} pending transaction(s))", batch.getBatchNumber(), rejected);
        return stagingStore.getBatch(batchId);
    }

    /**
     * Complete a reviewable batch once none of its transactions is PENDING.
     *
     * @return true if the batch moved to COMPLETED
     */
    public boolean completeIfDecided(String batchId) {
        ImportBatch batch = stagingStore.getBatch(batchId);
        if (!COMPLETABLE.contains(batch.getStatus()) || stagingStore.countPending(batchId) > 0) {
            return false;
        }
        boolean completed = progressTracker.advance(batchId, ImportBatchStatus.COMPLETED, 100, "All transactions reviewed");
        if (completed) {
            log.info("Batch {} completed", batch.getBatchNumber());
        }
        return completed;
    }

    private ApprovalResult resume(StagedTransaction staged) {
        if (staged.getEconomicEventId() != null) {
            return new ApprovalResult(staged, staged.getEconomicEventId(), null, true);
        }
        Optional<EconomicEvent> existing = economicEventRepository.findByStagedTransactionId(staged.getId());
        if (existing.isPresent()) {
            return completeLink(staged, existing.get().getId());
        }
        log.info("Transaction {} is approved without an economic event; creating it", staged.getId());
        return createAndReconcile(staged, true);
    }

    private ApprovalResult completeLink(StagedTransaction staged, String eventId) {
        log.info("Transaction {} has event {} but no link; completing the approval", staged.getId(), eventId);
        try {
            if (!stagingStore.linkEvent(staged.getId(), eventId)) {
                log.debug("Transaction {} linked concurrently", staged.getId());
            }
            ReconciliationResult reconciliation = budgetReconciler.reconcileIfAbsent(staged, eventId);
            completeIfDecided(staged.getBatchId());
            return new ApprovalResult(staged, eventId, reconciliation, true);
        } catch (RuntimeException e) {
            progressTracker.reportError(staged.getBatchId(), APPROVAL_STAGE,
                    "Failed to approve transaction " + staged.getId() + ": " + e.getMessage());
            throw e;
        }
    }

    private ApprovalResult createAndReconcile(StagedTransaction approved, boolean resuming) {
        String batchId = approved.getBatchId();
        try {
            progressTracker.advance(batchId, ImportBatchStatus.APPROVING, 90, "Approving transactions");
            EconomicEvent event = economicEventFactory.createFromStaged(approved);
            ReconciliationResult reconciliation = budgetReconciler.reconcile(approved, event.getId());
            if (approved.getCategorySource() == CategorySource.RULE && approved.getAppliedRuleId() != null) {
                transactionRuleRepository.incrementCorrectCount(approved.getAppliedRuleId());
            }
            completeIfDecided(batchId);
            log.info("Approved transaction {} -> event {}", approved.getId(), event.getId());
            return new ApprovalResult(approved, event.getId(), reconciliation, false);
        } catch (EconomicEventException e) {
            if (resuming && EconomicEventException.EVENT_ALREADY_CREATED.equals(e.getErrorCode())) {
                log.debug("Transaction {} approved concurrently", approved.getId());
                return new ApprovalResult(approved, approved.getEconomicEventId(), null, true);
            }
            progressTracker.reportError(batchId, APPROVAL_STAGE, "Failed to approve transaction " + approved.getId() + ": " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            progressTracker.reportError(batchId, APPROVAL_STAGE, "Failed to approve transaction " + approved.getId() + ": " + e.getMessage());
            throw e;
        }
    }

    private StagedTransaction decide(String stagedTransactionId, ReviewStatus target, String note) {
        StagedTransaction staged = stagingStore.getStaged(stagedTransactionId);
        if (staged.getReviewStatus() == target) {
            return staged;
        }
        if (staged.getReviewStatus() != ReviewStatus.PENDING) {
            throw invalidTransition(staged, target);
        }
        StagedTransaction decided = stagingStore.transition(stagedTransactionId, ReviewStatus.PENDING, target, note)
                .orElseThrow(() -> invalidTransition(stagingStore.getStaged(stagedTransactionId), target));
        log.info("Transaction {} -> {}", stagedTransactionId, target);
        completeIfDecided(decided.getBatchId());
        return decided;
    }

    private static boolean overridesMachineCategory(StagedTransaction before, String category) {
        return before.getCategorySource() != null
                && before.getCategorySource() != CategorySource.MANUAL
                && before.getCategory() != null
                && !before.getCategory().equals(category);
    }

    private static StagedTransactionException invalidTransition(StagedTransaction staged, ReviewStatus target) {
        return new StagedTransactionException(StagedTransactionException.INVALID_REVIEW_TRANSITION,
                "Transaction " + staged.getId() + " is " + staged.getReviewStatus() + " and cannot become " + target);
    }

    private static String errorCodeOf(RuntimeException e) {
        if (e instanceof StagedTransactionException s) {
            return s.getErrorCode();
        }
        if (e instanceof EconomicEventException s) {
            return s.getErrorCode();
        }
        if (e instanceof ReconciliationException s) {
            return s.getErrorCode();
        }
        return null;
    }
}
