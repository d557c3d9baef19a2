package com.ledgerimport.reconciliation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Budget health thresholds (ratio of total actual to total planned) and variance alerting.
 */
@ConfigurationProperties(prefix = "ledgerimport.budget")
@NoArgsConstructor
@Getter
@Setter
public class ReconciliationProperties {

    /** Actual up to this multiple of planned is HEALTHY. */
    private BigDecimal warningRatio = new BigDecimal("1.10");

    /** Actual up to this multiple of planned is WARNING; above it CRITICAL. */
    private BigDecimal criticalRatio = new BigDecimal("1.20");

    /** Variance points kept per budget. */
    private int varianceTrendLength = 30;

    /** Category overrun (percent of planned) that raises a warning alert. */
    private BigDecimal categoryWarningPercent = new BigDecimal("10");

    /** Category overrun (percent of planned) that raises a critical alert. */
    private BigDecimal categoryCriticalPercent = new BigDecimal("20");
}
