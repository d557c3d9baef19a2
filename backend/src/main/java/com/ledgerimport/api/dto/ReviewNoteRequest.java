package com.ledgerimport.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Optional body of reject and flag calls.
 */
public record ReviewNoteRequest(
        @Size(max = 500)
        String note
) {
}
