package com.ledgerimport.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BulkApprovalRequest(
        @NotEmpty(message = "IDS_REQUIRED")
        @Size(max = 1000)
        List<@NotBlank String> ids
) {
}
