package com.ledgerimport.api.dto;

import com.ledgerimport.ledger.CorrectionReason;
import com.ledgerimport.ledger.EventCorrection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * POST /api/v1/events/{id}/corrections. Only the fields to change are set.
 */
public record CorrectionRequest(
        @NotNull(message = "REASON_REQUIRED")
        CorrectionReason reason,

        @NotBlank(message = "ACTOR_REQUIRED")
        String actor,

        @PositiveOrZero
        BigDecimal quantity,

        Instant occurredAt,
        String providerId,
        String receiverId,
        String category,
        String budgetId,
        String budgetCategoryId,

        @Size(max = 500)
        String note
) {

    public EventCorrection toCorrection() {
        return new EventCorrection(quantity, occurredAt, providerId, receiverId, category, budgetId, budgetCategoryId, note);
    }
}
