package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.domain.CategoryAssignment;
import com.ledgerimport.domain.CategorySource;
import com.ledgerimport.domain.ImportBatch;
import com.ledgerimport.domain.ReviewStatus;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.domain.StagedTransactionRepository;
import com.ledgerimport.domain.TransactionRuleRepository;
import com.ledgerimport.ingestion.config.ClassifierProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Categorizes every pending, non-manual staged transaction of a batch in classifier-sized chunks and writes results
 * back with conditional updates (a reviewer's manual category always wins).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchCategorizationService {

    private final StagedTransactionRepository stagedTransactionRepository;
    private final TransactionRuleRepository transactionRuleRepository;
    private final Categorizer categorizer;
    private final ClassifierProperties classifierProperties;

    /**
     * @return number of staged transactions whose category was written
     */
    public int categorizeBatch(ImportBatch batch) {
        List<StagedTransaction> pending = stagedTransactionRepository.findByBatchIdAndReviewStatusAndCategorySourceNot(
                batch.getId(), ReviewStatus.PENDING, CategorySource.MANUAL);
        int chunkSize = Math.max(1, classifierProperties.getChunkSize());
        int applied = 0;
        for (int start = 0; start < pending.size(); start += chunkSize) {
            List<StagedTransaction> chunk = pending.subList(start, Math.min(start + chunkSize, pending.size()));
            Map<String, CategoryAssignment> assignments = categorizer.categorize(batch.getOwnerId(), chunk);
            for (Map.Entry<String, CategoryAssignment> e : assignments.entrySet()) {
                if (stagedTransactionRepository.applyCategory(e.getKey(), e.getValue())) {
                    applied++;
                    if (e.getValue().ruleId() != null) {
                        transactionRuleRepository.incrementAppliedCount(e.getValue().ruleId());
                    }
                }
            }
        }
        log.info("Batch {}: categorized {} of {} pending transaction(s)", batch.getBatchNumber(), applied, pending.size());
        return applied;
    }
}
