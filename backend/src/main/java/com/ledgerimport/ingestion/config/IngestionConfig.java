package com.ledgerimport.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerimport.common.RetryPolicy;
import com.ledgerimport.ingestion.adapter.BatchClassifier;
import com.ledgerimport.ingestion.adapter.DisabledBatchClassifier;
import com.ledgerimport.ingestion.adapter.TransactionAggregator;
import com.ledgerimport.ingestion.adapter.WebClientBatchClassifier;
import com.ledgerimport.ingestion.adapter.WebClientTransactionAggregator;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the outbound adapters (aggregator, classifier) from ledgerimport.* properties.
 */
@Configuration
@EnableConfigurationProperties({ AggregatorProperties.class, ClassifierProperties.class, CategorizationProperties.class, DuplicateProperties.class })
@Slf4j
public class IngestionConfig {

    public static final String AGGREGATOR_RATE_LIMITER = "aggregatorRateLimiter";

    @Bean(name = AGGREGATOR_RATE_LIMITER)
    public RateLimiter aggregatorRateLimiter(AggregatorProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("aggregator", config);
    }

    @Bean
    public TransactionAggregator transactionAggregator(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                                       AggregatorProperties properties,
                                                       @Qualifier(AGGREGATOR_RATE_LIMITER) RateLimiter rateLimiter) {
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getRetryBaseDelayMs(),
                properties.getRetryJitterFactor(),
                properties.getRetryMaxAttempts());
        return new WebClientTransactionAggregator(webClientBuilder.clone(), objectMapper, properties, retryPolicy, rateLimiter);
    }

    @Bean
    public BatchClassifier batchClassifier(WebClient.Builder webClientBuilder, ClassifierProperties properties) {
        if (!properties.isEnabled() || properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            log.info("External batch classifier disabled; categorization uses rules and merchant patterns only");
            return new DisabledBatchClassifier();
        }
        return new WebClientBatchClassifier(webClientBuilder.clone(), properties);
    }
}
