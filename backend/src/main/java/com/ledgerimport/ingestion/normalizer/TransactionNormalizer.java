package com.ledgerimport.ingestion.normalizer;

import com.ledgerimport.domain.ExternalTransaction;
import com.ledgerimport.domain.TransactionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts aggregator records to {@link NormalizedTransaction}. Kind is inferred from the description first
 * (fee, then transfer keywords) and only then from the sign of the amount. Pure; no I/O.
 */
@Component
@Slf4j
public class TransactionNormalizer {

    static final String DEFAULT_CURRENCY = "USD";

    private static final List<String> FEE_KEYWORDS = List.of("fee", "charge", "interest");
    private static final List<String> TRANSFER_KEYWORDS = List.of("transfer", "move", "xfer");

    /**
     * @throws InvalidExternalTransactionException if id, account, amount, date or description is missing
     */
    public NormalizedTransaction normalize(ExternalTransaction external) {
        validate(external);
        String description = external.name().strip();
        String merchant = external.merchantName() == null || external.merchantName().isBlank()
                ? null : external.merchantName().strip();
        String currency = external.currency() == null || external.currency().isBlank()
                ? DEFAULT_CURRENCY : external.currency().strip().toUpperCase(Locale.ROOT);
        return new NormalizedTransaction(
                external.transactionId(),
                external.accountId(),
                external.date(),
                external.date().atStartOfDay(ZoneOffset.UTC).toInstant(),
                inferKind(description, external.amount()),
                external.amount().abs(),
                external.amount().signum() < 0,
                currency,
                description,
                merchant,
                external.raw());
    }

    /**
     * Normalize every record, collecting malformed ones instead of failing the whole fetch.
     */
    public NormalizationResult normalizeAll(List<ExternalTransaction> externals) {
        List<NormalizedTransaction> valid = new ArrayList<>(externals.size());
        List<String> rejections = new ArrayList<>();
        for (ExternalTransaction external : externals) {
            try {
                valid.add(normalize(external));
            } catch (InvalidExternalTransactionException e) {
                log.warn("Skipping malformed external transaction {}: {}", e.getExternalTransactionId(), e.getMessage());
                rejections.add(e.getExternalTransactionId() + ": " + e.getMessage());
            }
        }
        return new NormalizationResult(valid, rejections);
    }

    static TransactionKind inferKind(String description, BigDecimal signedAmount) {
        String text = description.toLowerCase(Locale.ROOT);
        if (FEE_KEYWORDS.stream().anyMatch(text::contains)) {
            return TransactionKind.FEE;
        }
        if (TRANSFER_KEYWORDS.stream().anyMatch(text::contains)) {
            return TransactionKind.TRANSFER;
        }
        return signedAmount.signum() < 0 ? TransactionKind.DEBIT : TransactionKind.CREDIT;
    }

    private static void validate(ExternalTransaction external) {
        if (external == null) {
            throw new InvalidExternalTransactionException(null, "record is null");
        }
        String id = external.transactionId();
        if (id == null || id.isBlank()) {
            throw new InvalidExternalTransactionException(null, "transaction id is missing");
        }
        if (external.accountId() == null || external.accountId().isBlank()) {
            throw new InvalidExternalTransactionException(id, "account id is missing");
        }
        if (external.amount() == null) {
            throw new InvalidExternalTransactionException(id, "amount is missing");
        }
        if (external.date() == null) {
            throw new InvalidExternalTransactionException(id, "date is missing");
        }
        if (external.name() == null || external.name().isBlank()) {
            throw new InvalidExternalTransactionException(id, "description is missing");
        }
    }
}
