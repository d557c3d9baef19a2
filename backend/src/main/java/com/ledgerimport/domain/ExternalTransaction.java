package com.ledgerimport.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw record as returned by the transaction aggregator. Signed amount (negative = money out).
 * {@code raw} is the aggregator payload kept verbatim for audit; never mutated after fetch.
 */
public record ExternalTransaction(
        String transactionId,
        String accountId,
        BigDecimal amount,
        String currency,
        LocalDate date,
        String name,
        String merchantName,
        boolean pending,
        Map<String, Object> raw
) {

    public ExternalTransaction {
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }
}
