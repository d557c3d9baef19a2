package com.ledgerimport.domain;

import com.ledgerimport.config.MongoConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class ReviewStateMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    StagedTransactionRepository stagedTransactionRepository;
    @Autowired
    EconomicEventRepository economicEventRepository;
    @Autowired
    ImportBatchRepository importBatchRepository;

    @BeforeEach
    void clean() {
        stagedTransactionRepository.deleteAll();
        economicEventRepository.deleteAll();
        importBatchRepository.deleteAll();
    }

    @Test
    @DisplayName("a pending transaction can be claimed for approval exactly once")
    void transitionReviewStatus_once() {
        StagedTransaction s = stagedTransactionRepository.save(staged("tx-1", false));

        assertThat(stagedTransactionRepository.transitionReviewStatus(s.getId(), ReviewStatus.PENDING, ReviewStatus.APPROVED, null))
                .hasValueSatisfying(t -> assertThat(t.getReviewStatus()).isEqualTo(ReviewStatus.APPROVED));
        assertThat(stagedTransactionRepository.transitionReviewStatus(s.getId(), ReviewStatus.PENDING, ReviewStatus.APPROVED, null))
                .isEmpty();
        assertThat(stagedTransactionRepository.transitionReviewStatus(s.getId(), ReviewStatus.PENDING, ReviewStatus.REJECTED, "late"))
                .isEmpty();
    }

    @Test
    void transitionReviewStatus_duplicateNeverApproved() {
        StagedTransaction s = stagedTransactionRepository.save(staged("tx-1", true));

        assertThat(stagedTransactionRepository.transitionReviewStatus(s.getId(), ReviewStatus.PENDING, ReviewStatus.APPROVED, null))
                .isEmpty();
        assertThat(stagedTransactionRepository.transitionReviewStatus(s.getId(), ReviewStatus.PENDING,
                ReviewStatus.NEEDS_ATTENTION, "Suspected duplicate")).isPresent();
    }

    @Test
    @DisplayName("event link is written once and the amount survives as Decimal128")
    void linkEconomicEvent_once() {
        StagedTransaction s = stagedTransactionRepository.save(staged("tx-1", false));
        stagedTransactionRepository.transitionReviewStatus(s.getId(), ReviewStatus.PENDING, ReviewStatus.APPROVED, null);

        assertThat(stagedTransactionRepository.linkEconomicEvent(s.getId(), "e1")).isTrue();
        assertThat(stagedTransactionRepository.linkEconomicEvent(s.getId(), "e2")).isFalse();
        StagedTransaction reloaded = stagedTransactionRepository.findById(s.getId()).orElseThrow();
        assertThat(reloaded.getEconomicEventId()).isEqualTo("e1");
        assertThat(reloaded.getAmount()).isEqualByComparingTo("12.50");
    }

    @Test
    void economicEvent_uniquePerStagedTransaction() {
        economicEventRepository.insert(event("s1"));

        assertThatThrownBy(() -> economicEventRepository.insert(event("s1"))).isInstanceOf(DuplicateKeyException.class);
        // correcting events carry no staged transaction id
        economicEventRepository.insert(event(null));
        economicEventRepository.insert(event(null));
        assertThat(economicEventRepository.count()).isEqualTo(3);
    }

    @Test
    void manualCategory_notOverwrittenByCategorization() {
        StagedTransaction s = stagedTransactionRepository.save(staged("tx-1", false));
        stagedTransactionRepository.applyManualCategory(s.getId(), "Dining", "b1", "c-dining");

        boolean applied = stagedTransactionRepository.applyCategory(s.getId(), CategoryAssignment.of(
                new CategorySuggestion("Groceries", 75, "Merchant pattern: kroger", SuggestionSource.PATTERN), CategorySource.RULE));

        assertThat(applied).isFalse();
        assertThat(stagedTransactionRepository.findById(s.getId()).orElseThrow().getCategory()).isEqualTo("Dining");
    }

    @Test
    @DisplayName("batch status only moves forward and rejection is refused once terminal")
    void advanceStatus_forwardOnly() {
        ImportBatch batch = new ImportBatch();
        batch.setBatchNumber("IB-0000AAAA");
        batch.setOwnerId("owner-1");
        batch.setStartDate(LocalDate.of(2024, 3, 1));
        batch.setEndDate(LocalDate.of(2024, 3, 31));
        batch = importBatchRepository.insert(batch);

        assertThat(importBatchRepository.advanceStatus(batch.getId(), ImportBatchStatus.STAGING, 60, "Staging")).isTrue();
        assertThat(importBatchRepository.advanceStatus(batch.getId(), ImportBatchStatus.FETCHING, 10, "Fetching")).isFalse();
        assertThat(importBatchRepository.advanceStatus(batch.getId(), ImportBatchStatus.COMPLETED, 100, "Done")).isTrue();
        assertThat(importBatchRepository.reject(batch.getId(), "too late")).isFalse();
        assertThat(importBatchRepository.findById(batch.getId()).orElseThrow().getCompletedAt()).isNotNull();
    }

    @Test
    @DisplayName("each dispatch counts an attempt and an abandoned batch drops out of recovery")
    void categorizationDispatch_countsAttemptsUntilAbandoned() {
        ImportBatch batch = new ImportBatch();
        batch.setBatchNumber("IB-0000BBBB");
        batch.setOwnerId("owner-1");
        batch.setStatus(ImportBatchStatus.STAGING);
        batch.setCategorizationEnabled(true);
        batch = importBatchRepository.insert(batch);

        importBatchRepository.markCategorizationDispatched(batch.getId());
        importBatchRepository.markCategorizationDispatched(batch.getId());
        Instant later = Instant.now().plusSeconds(60);
        List<ImportBatchStatus> terminal = List.of(ImportBatchStatus.REJECTED, ImportBatchStatus.COMPLETED);

        assertThat(importBatchRepository.findById(batch.getId()).orElseThrow().getCategorizationAttempts()).isEqualTo(2);
        assertThat(importBatchRepository
                .findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
                        later, terminal))
                .extracting(ImportBatch::getId).containsExactly(batch.getId());

        importBatchRepository.markCategorizationAbandoned(batch.getId(), "gave up");

        assertThat(importBatchRepository
                .findByCategorizationEnabledTrueAndCategorizationCompletedAtIsNullAndCategorizationAbandonedAtIsNullAndCategorizationDispatchedAtBeforeAndStatusNotIn(
                        later, terminal))
                .isEmpty();
        assertThat(importBatchRepository.findById(batch.getId()).orElseThrow().getCategorizationAbandonedAt()).isNotNull();
    }

    @Test
    void rejectPending_leavesDecidedTransactions() {
        StagedTransaction approved = stagedTransactionRepository.save(staged("tx-1", false));
        stagedTransactionRepository.transitionReviewStatus(approved.getId(), ReviewStatus.PENDING, ReviewStatus.APPROVED, null);
        stagedTransactionRepository.save(staged("tx-2", false));

        assertThat(stagedTransactionRepository.rejectPending("batch-1", "wrong account")).isEqualTo(1);
        assertThat(stagedTransactionRepository.findByBatchIdOrderByTimestampAsc("batch-1"))
                .extracting(StagedTransaction::getReviewStatus)
                .containsExactlyInAnyOrder(ReviewStatus.APPROVED, ReviewStatus.REJECTED);
    }

    @Test
    void rejectUndecided_includesFlaggedButNotApproved() {
        StagedTransaction approved = stagedTransactionRepository.save(staged("tx-1", false));
        stagedTransactionRepository.transitionReviewStatus(approved.getId(), ReviewStatus.PENDING, ReviewStatus.APPROVED, null);
        StagedTransaction flagged = stagedTransactionRepository.save(staged("tx-2", true));
        stagedTransactionRepository.transitionReviewStatus(flagged.getId(), ReviewStatus.PENDING, ReviewStatus.NEEDS_ATTENTION, null);
        stagedTransactionRepository.save(staged("tx-3", false));

        assertThat(stagedTransactionRepository.rejectUndecided("batch-1", "import failed")).isEqualTo(2);
        assertThat(stagedTransactionRepository.findByBatchIdOrderByTimestampAsc("batch-1"))
                .extracting(StagedTransaction::getReviewStatus)
                .containsExactlyInAnyOrder(ReviewStatus.APPROVED, ReviewStatus.REJECTED, ReviewStatus.REJECTED);
    }

    private static StagedTransaction staged(String externalId, boolean duplicate) {
        StagedTransaction s = new StagedTransaction();
        s.setBatchId("batch-1");
        s.setOwnerId("owner-1");
        s.setExternalTransactionId(externalId);
        s.setExternalAccountId("acc-1");
        s.setTimestamp(Instant.parse("2024-03-05T00:00:00Z"));
        s.setKind(TransactionKind.DEBIT);
        s.setAmount(new BigDecimal("12.50"));
        s.setCurrency("USD");
        s.setDescription("KROGER #221");
        s.setDuplicate(duplicate);
        s.setCategorySource(CategorySource.RULE);
        s.setCreatedAt(Instant.now());
        return s;
    }

    private static EconomicEvent event(String stagedTransactionId) {
        EconomicEvent e = new EconomicEvent();
        e.setEventType(EconomicEventType.TRANSFER);
        e.setAction(EconomicAction.TRANSFER);
        e.setQuantity(new BigDecimal("12.50"));
        e.setUnit("USD");
        e.setState(EventState.VALIDATED);
        e.setStagedTransactionId(stagedTransactionId);
        e.setCreatedBy("owner-1");
        e.setCreatedAt(Instant.now());
        return e;
    }
}
