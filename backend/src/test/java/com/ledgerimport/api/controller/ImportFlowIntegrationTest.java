package com.ledgerimport.api.controller;

import com.ledgerimport.api.dto.ImportBatchResponse;
import com.ledgerimport.api.dto.StagedTransactionResponse;
import com.ledgerimport.domain.AggregatorConnection;
import com.ledgerimport.domain.AggregatorConnectionRepository;
import com.ledgerimport.domain.Budget;
import com.ledgerimport.domain.BudgetCategory;
import com.ledgerimport.domain.BudgetRepository;
import com.ledgerimport.domain.DateRange;
import com.ledgerimport.domain.EconomicEventRepository;
import com.ledgerimport.domain.ExternalTransaction;
import com.ledgerimport.domain.ImportBatchRepository;
import com.ledgerimport.domain.RegisteredTransactionRepository;
import com.ledgerimport.domain.StagedTransactionRepository;
import com.ledgerimport.ingestion.adapter.AggregatorException;
import com.ledgerimport.ingestion.adapter.TransactionAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class ImportFlowIntegrationTest {

    private static final DateRange MARCH = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    AggregatorConnectionRepository aggregatorConnectionRepository;
    @Autowired
    BudgetRepository budgetRepository;
    @Autowired
    ImportBatchRepository importBatchRepository;
    @Autowired
    StagedTransactionRepository stagedTransactionRepository;
    @Autowired
    EconomicEventRepository economicEventRepository;
    @Autowired
    RegisteredTransactionRepository registeredTransactionRepository;

    @MockBean
    TransactionAggregator transactionAggregator;

    @BeforeEach
    void seed() {
        importBatchRepository.deleteAll();
        stagedTransactionRepository.deleteAll();
        economicEventRepository.deleteAll();
        registeredTransactionRepository.deleteAll();
        aggregatorConnectionRepository.deleteAll();
        budgetRepository.deleteAll();

        AggregatorConnection connection = new AggregatorConnection();
        connection.setId("conn-1");
        connection.setOwnerId("owner-1");
        connection.setInstitutionName("First Sandbox Bank");
        connection.setStatus(AggregatorConnection.ConnectionStatus.ACTIVE);
        aggregatorConnectionRepository.save(connection);

        Budget budget = new Budget();
        budget.setId("b1");
        budget.setOwnerId("owner-1");
        budget.setName("March");
        budget.setCategories(new ArrayList<>(List.of(new BudgetCategory("c-dining", "Dining", new BigDecimal("500")))));
        budgetRepository.save(budget);
    }

    @Test
    @DisplayName("import, categorize by hand, approve twice: one event, one budget update")
    void importReviewApprove() {
        when(transactionAggregator.fetch(any(), eq(MARCH), any(Duration.class))).thenReturn(List.of(
                external("tx-1", "-12.50", "STARBUCKS #4411", "Starbucks"),
                external("tx-2", "-40.00", "SHELL OIL 5521", null)));

        ImportBatchResponse batch = startImport()
                .expectStatus().isCreated()
                .expectBody(ImportBatchResponse.class)
                .returnResult().getResponseBody();
        assertThat(batch).isNotNull();
        assertThat(batch.status()).isEqualTo("REVIEWING");
        assertThat(batch.totalTransactions()).isEqualTo(2);
        assertThat(batch.newTransactions()).isEqualTo(2);
        assertThat(batch.duplicateTransactions()).isZero();
        assertThat(batch.stagedTransactionIds()).hasSize(2);
        String batchId = batch.id();

        List<StagedTransactionResponse> staged = webTestClient.get()
                .uri("/api/v1/imports/{batchId}/transactions", batchId)
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(StagedTransactionResponse.class)
                .returnResult().getResponseBody();
        assertThat(staged).hasSize(2);
        String starbucksId = staged.stream().filter(s -> "tx-1".equals(s.externalTransactionId())).findFirst()
                .orElseThrow().id();

        webTestClient.put()
                .uri("/api/v1/staged-transactions/{id}/category", starbucksId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("category", "Dining", "budgetId", "b1", "budgetCategoryId", "c-dining"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.categorySource").isEqualTo("MANUAL");

        webTestClient.post()
                .uri("/api/v1/staged-transactions/{id}/approve", starbucksId)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alreadyApproved").isEqualTo(false)
                .jsonPath("$.reconciled").isEqualTo(true)
                .jsonPath("$.newActual").isEqualTo(12.5)
                .jsonPath("$.budgetHealth").isEqualTo("HEALTHY");

        webTestClient.post()
                .uri("/api/v1/staged-transactions/{id}/approve", starbucksId)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alreadyApproved").isEqualTo(true);

        assertThat(economicEventRepository.count()).isEqualTo(1);
        assertThat(budgetRepository.findById("b1").orElseThrow().findCategory("c-dining").orElseThrow().getActual())
                .isEqualByComparingTo("12.50");
    }

    @Test
    @DisplayName("re-importing the same period stages nothing new")
    void reimportIsDeduplicated() {
        when(transactionAggregator.fetch(any(), eq(MARCH), any(Duration.class))).thenReturn(List.of(
                external("tx-1", "-12.50", "STARBUCKS #4411", "Starbucks")));

        startImport().expectStatus().isCreated();
        startImport()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.newTransactions").isEqualTo(0)
                .jsonPath("$.duplicateTransactions").isEqualTo(1)
                .jsonPath("$.status").isEqualTo("COMPLETED");

        assertThat(stagedTransactionRepository.count()).isEqualTo(1);
    }

    @Test
    void fetchFailureIsBadGateway() {
        when(transactionAggregator.fetch(any(), eq(MARCH), any(Duration.class)))
                .thenThrow(new AggregatorException("HTTP 503 from aggregator", true));

        startImport()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("FETCH_FAILED");

        assertThat(importBatchRepository.findAll()).singleElement()
                .satisfies(b -> assertThat(b.getFailedStage()).isEqualTo("fetching"));
    }

    @Test
    void reversedDateRangeIsRejected() {
        webTestClient.post()
                .uri("/api/v1/imports")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ownerId", "owner-1", "connectionId", "conn-1",
                        "startDate", "2024-03-31", "endDate", "2024-03-01"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_DATE_RANGE");
    }

    @Test
    void approvingUnknownTransactionIsNotFound() {
        webTestClient.post()
                .uri("/api/v1/staged-transactions/{id}/approve", "does-not-exist")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("STAGED_NOT_FOUND");
    }

    private WebTestClient.ResponseSpec startImport() {
        return webTestClient.post()
                .uri("/api/v1/imports")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ownerId", "owner-1", "connectionId", "conn-1",
                        "startDate", "2024-03-01", "endDate", "2024-03-31", "categorize", false))
                .exchange();
    }

    private static ExternalTransaction external(String id, String amount, String name, String merchant) {
        return new ExternalTransaction(id, "acc-1", new BigDecimal(amount), "USD", LocalDate.of(2024, 3, 5), name,
                merchant, false, Map.of("transaction_id", id));
    }
}
