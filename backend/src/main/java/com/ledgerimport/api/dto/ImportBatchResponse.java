package com.ledgerimport.api.dto;

import com.ledgerimport.domain.ImportBatch;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record ImportBatchResponse(
        String id,
        String batchNumber,
        String ownerId,
        String connectionId,
        LocalDate startDate,
        LocalDate endDate,
        String status,
        int progressPct,
        String statusMessage,
        int totalTransactions,
        int newTransactions,
        int duplicateTransactions,
        int errorTransactions,
        List<String> stagedTransactionIds,
        boolean categorizationEnabled,
        boolean categorizationCompleted,
        String failedStage,
        String failureMessage,
        String rejectionReason,
        Instant createdAt,
        Instant completedAt
) {

    public static ImportBatchResponse from(ImportBatch b) {
        return new ImportBatchResponse(
                b.getId(),
                b.getBatchNumber(),
                b.getOwnerId(),
                b.getConnectionId(),
                b.getStartDate(),
                b.getEndDate(),
                b.getStatus() != null ? b.getStatus().name() : null,
                b.getProgressPct(),
                b.getStatusMessage(),
                b.getTotalTransactions(),
                b.getNewTransactions(),
                b.getDuplicateTransactions(),
                b.getErrorTransactions(),
                b.getStagedTransactionIds(),
                b.isCategorizationEnabled(),
                b.getCategorizationCompletedAt() != null,
                b.getFailedStage(),
                b.getFailureMessage(),
                b.getRejectionReason(),
                b.getCreatedAt(),
                b.getCompletedAt());
    }
}
