package com.ledgerimport.ingestion.adapter;

import lombok.Getter;

/**
 * Aggregator call failed. Retryable for rate limiting, 5xx, timeouts and connection errors.
 */
@Getter
public class AggregatorException extends RuntimeException {

    private final boolean retryable;

    public AggregatorException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public AggregatorException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
