package com.ledgerimport.ingestion.normalizer;

import com.ledgerimport.domain.TransactionKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Canonical form of an external transaction: unsigned amount, inferred kind, payload carried through unchanged.
 * {@code outflow} keeps the original direction, which the kind alone does not (a transfer can go either way).
 */
public record NormalizedTransaction(
        String externalTransactionId,
        String accountId,
        LocalDate date,
        Instant timestamp,
        TransactionKind kind,
        BigDecimal amount,
        boolean outflow,
        String currency,
        String description,
        String merchantName,
        Map<String, Object> rawPayload
) {

    /** Amount with the aggregator's sign restored: negative means money out. */
    public BigDecimal signedAmount() {
        return outflow ? amount.negate() : amount;
    }
}
