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

/**
 * Human override of a suggested category. Feeds classifier few-shot examples and merchant pattern learning.
 */
@Document(collection = "correction_records")
@CompoundIndexes({
    @CompoundIndex(name = "merchant_key", def = "{'merchantKey': 1}"),
    @CompoundIndex(name = "owner_corrected", def = "{'ownerId': 1, 'correctedAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CorrectionRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String ownerId;
    private String stagedTransactionId;
    private String merchantName;
    private String merchantKey;
    private String description;
    private BigDecimal amount;
    private String originalCategory;
    private int originalConfidence;
    private String correctedCategory;
    private String reason;
    /** True when this correction made the merchant eligible for an auto-rule. */
    private boolean ruleEligible;
    private Instant correctedAt;
}
