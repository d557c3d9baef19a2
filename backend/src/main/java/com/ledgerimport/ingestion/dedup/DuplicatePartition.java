package com.ledgerimport.ingestion.dedup;

import com.ledgerimport.ingestion.normalizer.NormalizedTransaction;

import java.util.List;

/**
 * Split of an incoming set into transactions to keep and suspected duplicates (with why).
 */
public record DuplicatePartition(List<NormalizedTransaction> unique, List<Flagged> duplicates) {

    public record Flagged(NormalizedTransaction transaction, DuplicateResult result) {
    }

    public int total() {
        return unique.size() + duplicates.size();
    }
}
