package com.ledgerimport.api.dto;

import com.ledgerimport.domain.EconomicEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record EconomicEventResponse(
        String id,
        String eventType,
        String action,
        Instant occurredAt,
        String providerId,
        String receiverId,
        BigDecimal quantity,
        String unit,
        String note,
        String state,
        String stagedTransactionId,
        String correctsEventId,
        String correctionReason,
        Map<String, Object> metadata,
        String createdBy,
        Instant createdAt
) {

    public static EconomicEventResponse from(EconomicEvent e) {
        Map<String, Object> metadata = new LinkedHashMap<>(e.getMetadata());
        metadata.remove("rawPayload");
        return new EconomicEventResponse(
                e.getId(),
                e.getEventType() != null ? e.getEventType().name() : null,
                e.getAction() != null ? e.getAction().name() : null,
                e.getOccurredAt(),
                e.getProviderId(),
                e.getReceiverId(),
                e.getQuantity(),
                e.getUnit(),
                e.getNote(),
                e.getState() != null ? e.getState().name() : null,
                e.getStagedTransactionId(),
                e.getCorrectsEventId(),
                e.getCorrectionReason(),
                metadata,
                e.getCreatedBy(),
                e.getCreatedAt());
    }
}
