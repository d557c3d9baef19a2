package com.ledgerimport.ledger;

/**
 * Reason code carried by a correcting event.
 */
public enum CorrectionReason {
    WRONG_AMOUNT,
    WRONG_DATE,
    WRONG_COUNTERPARTY,
    WRONG_CATEGORY,
    DUPLICATE_ENTRY,
    OTHER
}
