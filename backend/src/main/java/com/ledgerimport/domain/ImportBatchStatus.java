package com.ledgerimport.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Pipeline stage of an import batch. Declaration order is the forward order; a batch only moves to a later stage.
 * ERROR is reported on the error stream only; REJECTED is reachable from any non-terminal stage.
 */
public enum ImportBatchStatus {
    CREATED,
    FETCHING,
    NORMALIZING,
    DEDUPLICATING,
    STAGING,
    CATEGORIZING,
    REVIEWING,
    APPROVING,
    COMPLETED,
    ERROR,
    REJECTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == REJECTED;
    }

    /** Lower-case stage name as shown on progress and error streams. */
    public String stageName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Statuses a batch may currently be in for a move to {@code target} to be allowed.
     */
    public static List<ImportBatchStatus> predecessorsOf(ImportBatchStatus target) {
        if (target == REJECTED) {
            return Arrays.stream(values()).filter(s -> !s.isTerminal()).toList();
        }
        return Arrays.stream(values())
                .filter(s -> !s.isTerminal() && s.ordinal() < target.ordinal())
                .toList();
    }
}
