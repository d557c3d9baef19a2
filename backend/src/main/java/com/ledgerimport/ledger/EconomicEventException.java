package com.ledgerimport.ledger;

import lombok.Getter;

/**
 * Ledger event could not be created or corrected. {@link #EVENT_ALREADY_CREATED} lets callers tell an idempotent
 * repeat apart from a real failure.
 */
@Getter
public class EconomicEventException extends RuntimeException {

    public static final String NOT_APPROVED = "NOT_APPROVED";
    public static final String EVENT_ALREADY_CREATED = "EVENT_ALREADY_CREATED";
    public static final String EVENT_NOT_FOUND = "EVENT_NOT_FOUND";
    public static final String EVENT_ALREADY_CORRECTED = "EVENT_ALREADY_CORRECTED";
    public static final String INVALID_CORRECTION = "INVALID_CORRECTION";

    private final String errorCode;

    public EconomicEventException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
