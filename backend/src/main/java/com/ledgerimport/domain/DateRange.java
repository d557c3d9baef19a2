package com.ledgerimport.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive date range of an import.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }
}
