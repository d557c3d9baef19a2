package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Authored auto-categorization rule. Evaluated before the merchant table, highest priority first.
 */
@Document(collection = "transaction_rules")
@CompoundIndex(name = "owner_enabled_priority", def = "{'ownerId': 1, 'enabled': 1, 'priority': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransactionRule {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String ownerId;
    private String name;
    private MatchType matchType;
    private MatchField matchField;
    private String matchValue;
    /** Upper bound for AMOUNT_RANGE; matchValue holds the lower bound. */
    private BigDecimal matchMaxValue;
    private String targetCategory;
    private String targetBudgetId;
    private String targetBudgetCategoryId;
    /** 0-100. */
    private int priority;
    private boolean enabled = true;
    private long appliedCount;
    /** Applications approved without a category change. */
    private long correctCount;
    private Instant createdAt;

    public double getAccuracyRate() {
        return appliedCount == 0 ? 0.0 : (double) correctCount / appliedCount;
    }

    public enum MatchType {
        EXACT,
        CONTAINS,
        STARTS_WITH,
        REGEX,
        MERCHANT,
        AMOUNT_RANGE
    }

    public enum MatchField {
        DESCRIPTION,
        MERCHANT,
        AMOUNT,
        ACCOUNT
    }
}
