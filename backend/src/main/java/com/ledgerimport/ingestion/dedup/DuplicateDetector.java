package com.ledgerimport.ingestion.dedup;

import com.ledgerimport.common.ContentDigest;
import com.ledgerimport.common.StringDistance;
import com.ledgerimport.common.TextNormalizer;
import com.ledgerimport.domain.RegisteredTransaction;
import com.ledgerimport.domain.RegisteredTransactionRepository;
import com.ledgerimport.ingestion.config.DuplicateProperties;
import com.ledgerimport.ingestion.normalizer.NormalizedTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Three-tier duplicate detection against the registry of previously accepted transactions:
 * exact external id (100), content hash (95), then fuzzy amount/date/description match (75-100).
 * Detection never registers; callers register once a transaction is accepted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateDetector {

    private final RegisteredTransactionRepository registry;
    private final DuplicateProperties properties;

    public DuplicateResult detect(NormalizedTransaction txn) {
        Optional<RegisteredTransaction> exact = registry.findByExternalTransactionId(txn.externalTransactionId());
        if (exact.isPresent()) {
            return DuplicateResult.exact(exact.get().getExternalTransactionId(), "Transaction id already imported");
        }
        Optional<RegisteredTransaction> hashed = registry.findFirstByFingerprint(fingerprint(txn));
        if (hashed.isPresent()) {
            return DuplicateResult.hash(hashed.get().getExternalTransactionId(),
                    "Same account, amount, date and description");
        }
        return detectFuzzy(txn);
    }

    /**
     * Keep only transactions that are neither registered duplicates nor repeats earlier in the same list.
     */
    public List<NormalizedTransaction> filterDuplicates(List<NormalizedTransaction> transactions) {
        return partition(transactions).unique();
    }

    /**
     * Split into unique and duplicate transactions. Repeats within the list are caught via a seen set of
     * ids and fingerprints local to this call.
     */
    public DuplicatePartition partition(List<NormalizedTransaction> transactions) {
        List<NormalizedTransaction> unique = new ArrayList<>();
        List<DuplicatePartition.Flagged> duplicates = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Set<String> seenFingerprints = new HashSet<>();
        for (NormalizedTransaction txn : transactions) {
            String fingerprint = fingerprint(txn);
            if (seenIds.contains(txn.externalTransactionId())) {
                duplicates.add(new DuplicatePartition.Flagged(txn,
                        DuplicateResult.exact(txn.externalTransactionId(), "Repeated within this import")));
                continue;
            }
            if (seenFingerprints.contains(fingerprint)) {
                duplicates.add(new DuplicatePartition.Flagged(txn,
                        DuplicateResult.hash(null, "Identical transaction earlier in this import")));
                continue;
            }
            seenIds.add(txn.externalTransactionId());
            seenFingerprints.add(fingerprint);
            DuplicateResult result = detect(txn);
            if (result.duplicate()) {
                duplicates.add(new DuplicatePartition.Flagged(txn, result));
            } else {
                unique.add(txn);
            }
        }
        return new DuplicatePartition(unique, duplicates);
    }

    /**
     * Record an accepted transaction so later detections see it. Registering the same external id twice is a no-op.
     */
    public RegisteredTransaction register(NormalizedTransaction txn, String stagedTransactionId) {
        Optional<RegisteredTransaction> existing = registry.findByExternalTransactionId(txn.externalTransactionId());
        if (existing.isPresent()) {
            return existing.get();
        }
        RegisteredTransaction entry = new RegisteredTransaction();
        entry.setExternalTransactionId(txn.externalTransactionId());
        entry.setAccountId(txn.accountId());
        entry.setFingerprint(fingerprint(txn));
        entry.setAmount(txn.signedAmount());
        entry.setDate(txn.date());
        entry.setDescription(txn.description());
        entry.setStagedTransactionId(stagedTransactionId);
        entry.setRegisteredAt(Instant.now());
        try {
            return registry.insert(entry);
        } catch (DuplicateKeyException e) {
            log.debug("Transaction {} registered concurrently", txn.externalTransactionId());
            return registry.findByExternalTransactionId(txn.externalTransactionId()).orElseThrow(() -> e);
        }
    }

    /**
     * Forget the entries of staged transactions that were discarded, so a re-import does not match against them.
     *
     * @return number of registry entries removed
     */
    public long unregister(Collection<String> stagedTransactionIds) {
        if (stagedTransactionIds.isEmpty()) {
            return 0;
        }
        return registry.deleteByStagedTransactionIdIn(stagedTransactionIds);
    }

    /**
     * SHA-256 over account | signed amount (2dp, half-up) | date | description (trimmed, lower-case).
     * A refund and the purchase it reverses differ in sign and so never share a fingerprint.
     */
    static String fingerprint(NormalizedTransaction txn) {
        String content = String.join("|",
                txn.accountId(),
                txn.signedAmount().setScale(2, RoundingMode.HALF_UP).toPlainString(),
                txn.date().toString(),
                txn.description().strip().toLowerCase(Locale.ROOT));
        return ContentDigest.sha256Hex(content);
    }

    private DuplicateResult detectFuzzy(NormalizedTransaction txn) {
        int windowDays = properties.getDateWindowDays();
        List<RegisteredTransaction> candidates = registry.findCandidates(
                txn.accountId(), txn.date().minusDays(windowDays), txn.date().plusDays(windowDays));
        String description = TextNormalizer.looseNormalize(txn.description());
        DuplicateResult best = DuplicateResult.notDuplicate();
        for (RegisteredTransaction candidate : candidates) {
            if (candidate.getAmount() == null || candidate.getDate() == null) {
                continue;
            }
            BigDecimal amountDiff = txn.signedAmount().subtract(candidate.getAmount()).abs();
            if (amountDiff.compareTo(properties.getAmountWindow()) > 0
                    || amountDiff.compareTo(properties.getAmountTolerance()) > 0) {
                continue;
            }
            long dayDiff = Math.abs(ChronoUnit.DAYS.between(candidate.getDate(), txn.date()));
            if (dayDiff > properties.getDateToleranceDays()) {
                continue;
            }
            int edits = StringDistance.levenshtein(description, TextNormalizer.looseNormalize(candidate.getDescription()));
            if (edits > properties.getMaxEditDistance()) {
                continue;
            }
            int confidence = fuzzyConfidence(amountDiff, dayDiff, edits);
            if (confidence >= properties.getMinimumFuzzyConfidence() && confidence > best.confidence()) {
                best = new DuplicateResult(true, confidence, DuplicateResult.MatchTier.FUZZY,
                        candidate.getExternalTransactionId(),
                        String.format("Near match: amount diff %s, %d day(s) apart, %d edit(s)",
                                amountDiff.toPlainString(), dayDiff, edits));
            }
        }
        return best;
    }

    /**
     * 75 base + up to 15 for amount closeness + up to 5 for date closeness + up to 5 for description closeness,
     * each scaled linearly against its window; capped at 100.
     */
    int fuzzyConfidence(BigDecimal amountDiff, long dayDiff, int edits) {
        double amountScore = 15.0 * closeness(amountDiff.divide(properties.getAmountWindow(), MathContext.DECIMAL64).doubleValue());
        double dateScore = 5.0 * closeness((double) dayDiff / properties.getDateWindowDays());
        double textScore = 5.0 * closeness((double) edits / properties.getEditWindow());
        return (int) Math.min(100, Math.round(75 + amountScore + dateScore + textScore));
    }

    private static double closeness(double ratio) {
        return Math.max(0.0, 1.0 - ratio);
    }
}
