package com.ledgerimport.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Fuzzy duplicate tolerances and confidence scaling windows.
 */
@ConfigurationProperties(prefix = "ledgerimport.duplicates")
@NoArgsConstructor
@Getter
@Setter
public class DuplicateProperties {

    /** Max absolute amount difference for a fuzzy match. */
    private BigDecimal amountTolerance = new BigDecimal("0.01");
    private int dateToleranceDays = 2;
    private int maxEditDistance = 3;

    /** Candidate window and amount-closeness scale. */
    private BigDecimal amountWindow = new BigDecimal("1.00");
    /** Candidate window and date-closeness scale. */
    private int dateWindowDays = 7;
    /** Description-closeness scale. */
    private int editWindow = 10;

    /** Fuzzy matches scoring below this are not duplicates. */
    private int minimumFuzzyConfidence = 75;
}
