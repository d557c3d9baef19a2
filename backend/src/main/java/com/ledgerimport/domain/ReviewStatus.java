package com.ledgerimport.domain;

/**
 * Review lifecycle of a staged transaction: PENDING moves exactly once to one of the other three, which are terminal.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED,
    NEEDS_ATTENTION;

    public boolean isDecided() {
        return this != PENDING;
    }
}
