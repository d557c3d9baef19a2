package com.ledgerimport.api.dto;

import com.ledgerimport.api.validation.ValidDateRange;
import com.ledgerimport.domain.DateRange;
import com.ledgerimport.ingestion.pipeline.ImportRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * POST /api/v1/imports request body. Empty accountIds = every account of the connection; categorize defaults to true.
 */
@ValidDateRange
public record StartImportRequest(
        @NotBlank(message = "OWNER_REQUIRED")
        String ownerId,

        @NotBlank(message = "CONNECTION_REQUIRED")
        String connectionId,

        List<String> accountIds,

        @NotNull(message = "INVALID_DATE_RANGE")
        LocalDate startDate,

        @NotNull(message = "INVALID_DATE_RANGE")
        LocalDate endDate,

        Boolean categorize,
        Boolean skipDuplicateCheck,
        ImportRequest.DuplicateHandling duplicateHandling,

        @Positive
        Long fetchTimeoutMs
) {

    public ImportRequest toImportRequest() {
        return new ImportRequest(
                ownerId,
                connectionId,
                accountIds,
                new DateRange(startDate, endDate),
                categorize == null || categorize,
                Boolean.TRUE.equals(skipDuplicateCheck),
                duplicateHandling,
                fetchTimeoutMs == null ? null : Duration.ofMillis(fetchTimeoutMs));
    }
}
