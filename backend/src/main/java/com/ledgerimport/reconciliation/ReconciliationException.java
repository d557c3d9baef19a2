package com.ledgerimport.reconciliation;

import lombok.Getter;

/**
 * Budget linkage points at a budget or category that does not exist. Never downgraded to a skip: spend must not be
 * attributed to a missing bucket.
 */
@Getter
public class ReconciliationException extends RuntimeException {

    public static final String BUDGET_NOT_FOUND = "BUDGET_NOT_FOUND";
    public static final String CATEGORY_NOT_FOUND = "CATEGORY_NOT_FOUND";

    private final String errorCode;

    public ReconciliationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
