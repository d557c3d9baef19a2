package com.ledgerimport.ingestion.normalizer;

import com.ledgerimport.domain.ExternalTransaction;
import com.ledgerimport.domain.TransactionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionNormalizerTest {

    private final TransactionNormalizer normalizer = new TransactionNormalizer();

    @Test
    @DisplayName("ATM Fee of -5.00 normalizes to FEE with amount 5.00 at midnight UTC")
    void normalize_atmFee() {
        ExternalTransaction external = new ExternalTransaction("tx-1", "acc-1", new BigDecimal("-5.00"), "usd",
                LocalDate.of(2024, 3, 1), "ATM Fee", null, false, Map.of("transaction_id", "tx-1"));

        NormalizedTransaction n = normalizer.normalize(external);

        assertThat(n.kind()).isEqualTo(TransactionKind.FEE);
        assertThat(n.amount()).isEqualByComparingTo("5.00");
        assertThat(n.outflow()).isTrue();
        assertThat(n.signedAmount()).isEqualByComparingTo("-5.00");
        assertThat(n.currency()).isEqualTo("USD");
        assertThat(n.timestamp()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(n.merchantName()).isNull();
        assertThat(n.rawPayload()).containsEntry("transaction_id", "tx-1");
    }

    @ParameterizedTest(name = "{0} ({1}) -> {2}")
    @CsvSource({
            "Coffee Shop, -4.50, DEBIT",
            "Payroll ACME, 2500.00, CREDIT",
            "Online Transfer to Savings, -100, TRANSFER",
            "Monthly maintenance charge, -12, FEE",
            "Interest paid, 0.42, FEE"
    })
    void inferKind(String description, String amount, TransactionKind expected) {
        assertThat(TransactionNormalizer.inferKind(description, new BigDecimal(amount))).isEqualTo(expected);
    }

    @Test
    void normalize_missingCurrencyDefaultsToUsd() {
        ExternalTransaction external = new ExternalTransaction("tx-2", "acc-1", new BigDecimal("10"), null,
                LocalDate.of(2024, 3, 2), "Refund", "  Shop  ", false, null);

        NormalizedTransaction n = normalizer.normalize(external);

        assertThat(n.currency()).isEqualTo("USD");
        assertThat(n.merchantName()).isEqualTo("Shop");
        assertThat(n.outflow()).isFalse();
        assertThat(n.signedAmount()).isEqualByComparingTo("10");
        assertThat(n.rawPayload()).isEmpty();
    }

    @Test
    void normalize_missingAmountThrows() {
        ExternalTransaction external = new ExternalTransaction("tx-3", "acc-1", null, "USD",
                LocalDate.of(2024, 3, 2), "Something", null, false, null);

        assertThatThrownBy(() -> normalizer.normalize(external))
                .isInstanceOf(InvalidExternalTransactionException.class)
                .hasMessageContaining("amount");
    }

    @Test
    @DisplayName("normalizeAll keeps valid records and collects malformed ones")
    void normalizeAll_collectsRejections() {
        ExternalTransaction good = new ExternalTransaction("tx-1", "acc-1", new BigDecimal("-3"), "USD",
                LocalDate.of(2024, 3, 1), "Bakery", null, false, null);
        ExternalTransaction noDate = new ExternalTransaction("tx-2", "acc-1", new BigDecimal("-3"), "USD",
                null, "Bakery", null, false, null);
        ExternalTransaction noDescription = new ExternalTransaction("tx-3", "acc-1", new BigDecimal("-3"), "USD",
                LocalDate.of(2024, 3, 1), " ", null, false, null);

        NormalizationResult result = normalizer.normalizeAll(Arrays.asList(good, noDate, noDescription));

        assertThat(result.transactions()).extracting(NormalizedTransaction::externalTransactionId).containsExactly("tx-1");
        assertThat(result.errorCount()).isEqualTo(2);
        assertThat(result.rejections()).anyMatch(r -> r.startsWith("tx-2"));
    }
}
