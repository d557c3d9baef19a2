package com.ledgerimport.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Correction learning thresholds and background categorization recovery.
 */
@ConfigurationProperties(prefix = "ledgerimport.categorization")
@NoArgsConstructor
@Getter
@Setter
public class CategorizationProperties {

    /** Corrections to one category needed before a merchant pattern is learned. */
    private int learningThreshold = 5;

    /** With contradicting corrections present, agreement must exceed this ratio. */
    private double agreementRatio = 0.90;

    /** Confidence given to seeded merchant defaults. */
    private int defaultPatternConfidence = 75;

    /** Recovery job interval (fixedDelay, ms). */
    private long recoveryIntervalMs = 300_000;

    /** Categorization dispatched longer ago than this without completing is re-dispatched. */
    private long staleAfterMinutes = 15;

    /** Dispatches (first run included) before recovery gives up on a batch. */
    private int maxAttempts = 3;
}
