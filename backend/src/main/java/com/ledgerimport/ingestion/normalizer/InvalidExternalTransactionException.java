package com.ledgerimport.ingestion.normalizer;

import lombok.Getter;

/**
 * External record is missing a field the pipeline cannot do without.
 */
@Getter
public class InvalidExternalTransactionException extends RuntimeException {

    private final String externalTransactionId;

    public InvalidExternalTransactionException(String externalTransactionId, String message) {
        super(message);
        this.externalTransactionId = externalTransactionId;
    }
}
