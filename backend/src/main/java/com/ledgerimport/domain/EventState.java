package com.ledgerimport.domain;

/**
 * Validation state of a ledger event. CORRECTED marks an event superseded by a correcting event.
 */
public enum EventState {
    VALIDATED,
    PENDING_VALIDATION,
    DISPUTED,
    CORRECTED
}
