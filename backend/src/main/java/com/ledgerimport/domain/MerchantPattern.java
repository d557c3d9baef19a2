package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Merchant to category mapping learned from corrections. Seeded defaults live in memory only.
 */
@Document(collection = "merchant_patterns")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MerchantPattern {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Loosely normalised merchant name. */
    @Indexed(unique = true)
    private String merchantKey;
    private String category;
    private int confidence;
    private Origin origin;
    private int correctionCount;
    private double agreementRatio;
    private Instant updatedAt;

    public enum Origin {
        DEFAULT,
        LEARNED
    }
}
