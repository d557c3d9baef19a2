package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Review unit: one fetched transaction awaiting a human decision. Amount is unsigned; {@link #kind} carries direction.
 * Review status and event linkage change only through the conditional updates in {@link StagedTransactionRepositoryCustom}
 * so concurrent reviewers and the background categorizer cannot clobber each other.
 */
@Document(collection = "staged_transactions")
@CompoundIndexes({
    @CompoundIndex(name = "batch_review", def = "{'batchId': 1, 'reviewStatus': 1}"),
    @CompoundIndex(name = "owner_created", def = "{'ownerId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "external_ref", def = "{'externalAccountId': 1, 'externalTransactionId': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StagedTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String batchId;
    private String ownerId;
    private String externalTransactionId;
    private String externalAccountId;
    private Instant timestamp;
    private TransactionKind kind;
    private BigDecimal amount;
    /** ISO currency code; no conversion is performed. */
    private String currency;
    private String description;
    private String merchantName;

    private String category;
    private int categoryConfidence;
    private CategorySource categorySource;
    private String categoryReasoning;
    private List<CategorySuggestion> suggestedCategories = new ArrayList<>();
    /** Authored rule that produced the category, for accuracy tracking. */
    private String appliedRuleId;
    private String budgetId;
    private String budgetCategoryId;

    private boolean duplicate;
    private String duplicateOfTransactionId;
    private Integer duplicateConfidence;

    private ReviewStatus reviewStatus = ReviewStatus.PENDING;
    /** Rejection reason or attention note. */
    private String reviewNote;
    private Instant reviewedAt;
    /** Set once when the ledger event is created; never cleared. */
    private String economicEventId;

    private Map<String, Object> rawPayload = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasBudgetLinkage() {
        return budgetId != null && !budgetId.isBlank() && budgetCategoryId != null && !budgetCategoryId.isBlank();
    }
}
