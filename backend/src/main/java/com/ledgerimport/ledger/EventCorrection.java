package com.ledgerimport.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Corrected values for a ledger event. Null fields keep the original value. {@code budgetId} and
 * {@code budgetCategoryId} move the event's amount to another budget category.
 */
public record EventCorrection(
        BigDecimal quantity,
        Instant occurredAt,
        String providerId,
        String receiverId,
        String category,
        String budgetId,
        String budgetCategoryId,
        String note
) {
}
