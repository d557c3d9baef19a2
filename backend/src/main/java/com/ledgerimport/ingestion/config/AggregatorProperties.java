package com.ledgerimport.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Transaction aggregator client: endpoint, credentials, paging, rate limit, retry and fetch deadline.
 */
@ConfigurationProperties(prefix = "ledgerimport.aggregator")
@NoArgsConstructor
@Getter
@Setter
public class AggregatorProperties {

    private String baseUrl = "https://sandbox.aggregator.example.com";
    private String clientId;
    private String secret;

    /** Records per page. */
    private int pageSize = 100;

    /** Whole-fetch deadline when the import request does not carry one. */
    private long fetchTimeoutMs = 10_000;

    /** Provider allows ~120 requests/minute per client. */
    private int requestsPerMinute = 120;

    /** Max wait for a limiter permit before the page call fails. */
    private long limiterTimeoutMs = 5_000;

    private long retryBaseDelayMs = 500;
    private double retryJitterFactor = 0.2;
    private int retryMaxAttempts = 3;

    /** Provider reports outflows as positive amounts; flip so negative means money out. */
    private boolean outflowPositive;
}
