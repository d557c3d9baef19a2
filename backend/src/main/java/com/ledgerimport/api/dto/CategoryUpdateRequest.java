package com.ledgerimport.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * PUT /api/v1/staged-transactions/{id}/category. Budget ids are optional; both or neither.
 */
public record CategoryUpdateRequest(
        @NotBlank(message = "CATEGORY_REQUIRED")
        @Size(max = 100)
        String category,

        String budgetId,
        String budgetCategoryId,

        @Size(max = 500)
        String reason
) {
}
