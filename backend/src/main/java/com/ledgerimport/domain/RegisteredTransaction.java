package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Duplicate-detection registry entry: one per accepted external transaction.
 */
@Document(collection = "registered_transactions")
@CompoundIndex(name = "account_date", def = "{'accountId': 1, 'date': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RegisteredTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String externalTransactionId;
    private String accountId;
    /** SHA-256 of account|amount|date|description. */
    @Indexed
    private String fingerprint;
    /** Signed amount, negative = money out. */
    private BigDecimal amount;
    private LocalDate date;
    private String description;
    private String stagedTransactionId;
    private Instant registeredAt;
}
