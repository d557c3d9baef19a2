package com.ledgerimport.domain;

/**
 * Direction/nature of a staged transaction. Amounts are stored unsigned; the kind carries the direction.
 */
public enum TransactionKind {
    DEBIT,
    CREDIT,
    FEE,
    TRANSFER
}
