package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only ledger entry. Economic fields are written once on insert; the only later change is {@link #state}
 * moving to CORRECTED when a correcting event supersedes it. One event per staged transaction (unique sparse index);
 * correcting events carry {@link #correctsEventId} instead.
 */
@Document(collection = "economic_events")
@CompoundIndexes({
    @CompoundIndex(name = "creator_occurred", def = "{'createdBy': 1, 'occurredAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EconomicEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private EconomicEventType eventType;
    private EconomicAction action;
    private Instant occurredAt;
    private String providerId;
    private String receiverId;
    private BigDecimal quantity;
    private String unit;
    private String note;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private EventState state;
    @Indexed(unique = true, sparse = true)
    private String stagedTransactionId;
    /** An event is corrected at most once; further corrections apply to the newest event. */
    @Indexed(unique = true, sparse = true)
    private String correctsEventId;
    private String correctionReason;
    private String createdBy;
    private Instant createdAt;
}
