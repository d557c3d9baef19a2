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

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One fetch run for an owner's connection. Counters are written once after deduplication:
 * newTransactions + duplicateTransactions == totalTransactions; malformed records only count in errorTransactions.
 */
@Document(collection = "import_batches")
@CompoundIndexes({
    @CompoundIndex(name = "owner_created", def = "{'ownerId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "categorization_pending", def = "{'categorizationEnabled': 1, 'categorizationCompletedAt': 1, 'categorizationDispatchedAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ImportBatch {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String batchNumber;
    private String ownerId;
    private String connectionId;
    private List<String> accountIds = new ArrayList<>();
    private LocalDate startDate;
    private LocalDate endDate;

    private int totalTransactions;
    private int newTransactions;
    private int duplicateTransactions;
    private int errorTransactions;

    private ImportBatchStatus status = ImportBatchStatus.CREATED;
    private int progressPct;
    private String statusMessage;
    /** Stage that failed; status stays at the last successful stage. */
    private String failedStage;
    private String failureMessage;
    private String rejectionReason;

    private List<String> stagedTransactionIds = new ArrayList<>();
    private boolean categorizationEnabled;
    private Instant categorizationDispatchedAt;
    private Instant categorizationCompletedAt;
    /** Dispatches so far, the first one included. */
    private int categorizationAttempts;
    /** Set once recovery stops re-dispatching; whatever was categorized stays reviewable. */
    private Instant categorizationAbandonedAt;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
}
