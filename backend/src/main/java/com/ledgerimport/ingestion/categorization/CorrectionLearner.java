package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.domain.AutoRuleEligibleEvent;
import com.ledgerimport.domain.CorrectionRecord;
import com.ledgerimport.domain.CorrectionRecordRepository;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.ingestion.config.CategorizationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Records human category corrections and learns merchant patterns from them. A merchant is learned once it has at
 * least {@code learningThreshold} corrections to the same category with no contradictions, or with agreement above
 * {@code agreementRatio}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorrectionLearner {

    static final int MIN_LEARNED_CONFIDENCE = 85;
    static final int MAX_LEARNED_CONFIDENCE = 95;

    private final CorrectionRecordRepository correctionRecordRepository;
    private final MerchantPatternTable merchantPatternTable;
    private final CategorizationProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * @param before the staged transaction as it was before the correction (carries the suggested category)
     */
    public CorrectionRecord recordCorrection(StagedTransaction before, String correctedCategory, String reason) {
        String merchantKey = merchantKey(before);
        CorrectionRecord record = new CorrectionRecord();
        record.setOwnerId(before.getOwnerId());
        record.setStagedTransactionId(before.getId());
        record.setMerchantName(before.getMerchantName());
        record.setMerchantKey(merchantKey);
        record.setDescription(before.getDescription());
        record.setAmount(before.getAmount());
        record.setOriginalCategory(before.getCategory());
        record.setOriginalConfidence(before.getCategoryConfidence());
        record.setCorrectedCategory(correctedCategory);
        record.setReason(reason);
        record.setCorrectedAt(Instant.now());
        record = correctionRecordRepository.save(record);

        if (merchantKey.isEmpty()) {
            return record;
        }
        List<CorrectionRecord> history = correctionRecordRepository.findByMerchantKey(merchantKey);
        long agreeing = history.stream().filter(c -> correctedCategory.equals(c.getCorrectedCategory())).count();
        long contradicting = history.size() - agreeing;
        double agreement = history.isEmpty() ? 0.0 : (double) agreeing / history.size();
        boolean eligible = agreeing >= properties.getLearningThreshold()
                && (contradicting == 0 || agreement > properties.getAgreementRatio());
        if (!eligible) {
            log.debug("Correction for {} recorded ({} agreeing, {} contradicting)", merchantKey, agreeing, contradicting);
            return record;
        }
        merchantPatternTable.learn(merchantKey, correctedCategory, learnedConfidence(agreement), (int) agreeing, agreement);
        record.setRuleEligible(true);
        record = correctionRecordRepository.save(record);
        applicationEventPublisher.publishEvent(new AutoRuleEligibleEvent(
                before.getOwnerId(), merchantKey, correctedCategory, (int) agreeing, agreement));
        return record;
    }

    static int learnedConfidence(double agreement) {
        int scaled = (int) Math.round(agreement * MAX_LEARNED_CONFIDENCE);
        return Math.max(MIN_LEARNED_CONFIDENCE, Math.min(MAX_LEARNED_CONFIDENCE, scaled));
    }

    static String merchantKey(StagedTransaction txn) {
        return MerchantPatternTable.keyFor(txn.getMerchantName(), txn.getDescription());
    }
}
