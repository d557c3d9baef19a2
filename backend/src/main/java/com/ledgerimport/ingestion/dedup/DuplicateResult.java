package com.ledgerimport.ingestion.dedup;

/**
 * Outcome of checking one transaction. {@code matchedTransactionId} is the external id of the earlier transaction.
 */
public record DuplicateResult(boolean duplicate, int confidence, MatchTier tier, String matchedTransactionId, String reason) {

    public enum MatchTier {
        EXACT,
        HASH,
        FUZZY,
        NONE
    }

    public static DuplicateResult notDuplicate() {
        return new DuplicateResult(false, 0, MatchTier.NONE, null, null);
    }

    public static DuplicateResult exact(String matchedTransactionId, String reason) {
        return new DuplicateResult(true, 100, MatchTier.EXACT, matchedTransactionId, reason);
    }

    public static DuplicateResult hash(String matchedTransactionId, String reason) {
        return new DuplicateResult(true, 95, MatchTier.HASH, matchedTransactionId, reason);
    }
}
