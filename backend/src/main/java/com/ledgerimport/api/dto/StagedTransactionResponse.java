package com.ledgerimport.api.dto;

import com.ledgerimport.domain.CategorySuggestion;
import com.ledgerimport.domain.StagedTransaction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Review view of a staged transaction. The raw aggregator payload is not exposed.
 */
public record StagedTransactionResponse(
        String id,
        String batchId,
        String externalTransactionId,
        String externalAccountId,
        Instant timestamp,
        String kind,
        BigDecimal amount,
        String currency,
        String description,
        String merchantName,
        String category,
        int categoryConfidence,
        String categorySource,
        String categoryReasoning,
        List<CategorySuggestion> suggestedCategories,
        String budgetId,
        String budgetCategoryId,
        boolean duplicate,
        String duplicateOfTransactionId,
        Integer duplicateConfidence,
        String reviewStatus,
        String reviewNote,
        String economicEventId
) {

    public static StagedTransactionResponse from(StagedTransaction s) {
        return new StagedTransactionResponse(
                s.getId(),
                s.getBatchId(),
                s.getExternalTransactionId(),
                s.getExternalAccountId(),
                s.getTimestamp(),
                s.getKind() != null ? s.getKind().name() : null,
                s.getAmount(),
                s.getCurrency(),
                s.getDescription(),
                s.getMerchantName(),
                s.getCategory(),
                s.getCategoryConfidence(),
                s.getCategorySource() != null ? s.getCategorySource().name() : null,
                s.getCategoryReasoning(),
                s.getSuggestedCategories(),
                s.getBudgetId(),
                s.getBudgetCategoryId(),
                s.isDuplicate(),
                s.getDuplicateOfTransactionId(),
                s.getDuplicateConfidence(),
                s.getReviewStatus() != null ? s.getReviewStatus().name() : null,
                s.getReviewNote(),
                s.getEconomicEventId());
    }
}
