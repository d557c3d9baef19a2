package com.ledgerimport.ingestion.store;

import lombok.Getter;

/**
 * Review operation on a staged transaction or batch is not possible. API maps NOT_FOUND codes to 404, the rest to 409.
 */
@Getter
public class StagedTransactionException extends RuntimeException {

    public static final String STAGED_NOT_FOUND = "STAGED_NOT_FOUND";
    public static final String BATCH_NOT_FOUND = "BATCH_NOT_FOUND";
    public static final String DUPLICATE_NOT_APPROVABLE = "DUPLICATE_NOT_APPROVABLE";
    public static final String INVALID_REVIEW_TRANSITION = "INVALID_REVIEW_TRANSITION";

    private final String errorCode;

    public StagedTransactionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
