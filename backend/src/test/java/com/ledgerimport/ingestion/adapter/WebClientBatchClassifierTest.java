package com.ledgerimport.ingestion.adapter;

import com.ledgerimport.ingestion.adapter.BatchClassifier.ClassificationItem;
import com.ledgerimport.ingestion.adapter.BatchClassifier.ClassificationResult;
import com.ledgerimport.ingestion.config.ClassifierProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientBatchClassifierTest {

    private static final List<ClassificationItem> ITEMS = List.of(
            new ClassificationItem("s1", "JOES PIZZA PLACE", null, "18.40", "DEBIT"));

    private ClassifierProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ClassifierProperties();
        properties.setEnabled(true);
        properties.setBaseUrl("http://classifier.test");
    }

    @Test
    void parsesResults() {
        WebClientBatchClassifier classifier = classifierReturning(HttpStatus.OK, """
                {"results": [{"transactionId": "s1", "category": "Dining", "confidence": 88,
                              "reasoning": "restaurant", "alternatives": [{"category": "Groceries", "confidence": 10}]}]}
                """);

        List<ClassificationResult> results = classifier.classify(ITEMS, List.of("Dining", "Groceries"), List.of());

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.category()).isEqualTo("Dining");
            assertThat(r.confidence()).isEqualTo(88);
            assertThat(r.alternatives()).extracting(BatchClassifier.Alternative::category).containsExactly("Groceries");
        });
    }

    @Test
    @DisplayName("a 200 with a body of the wrong shape is a classifier failure, not a decoding crash")
    void malformedBodyIsClassifierException() {
        WebClientBatchClassifier classifier = classifierReturning(HttpStatus.OK, "{\"results\":\"oops\"}");

        assertThatThrownBy(() -> classifier.classify(ITEMS, List.of("Dining"), List.of()))
                .isInstanceOf(ClassifierException.class)
                .hasMessageContaining("Unreadable classifier response");
    }

    @Test
    void missingResultsIsClassifierException() {
        WebClientBatchClassifier classifier = classifierReturning(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> classifier.classify(ITEMS, List.of("Dining"), List.of()))
                .isInstanceOf(ClassifierException.class)
                .hasMessageContaining("no results");
    }

    @Test
    void serverErrorIsClassifierException() {
        WebClientBatchClassifier classifier = classifierReturning(HttpStatus.BAD_GATEWAY, "{}");

        assertThatThrownBy(() -> classifier.classify(ITEMS, List.of("Dining"), List.of()))
                .isInstanceOf(ClassifierException.class)
                .hasMessageContaining("502");
    }

    @Test
    void unexpectedTransportErrorIsClassifierException() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new IllegalStateException("connection reset")));
        WebClientBatchClassifier classifier = new WebClientBatchClassifier(builder, properties);

        assertThatThrownBy(() -> classifier.classify(ITEMS, List.of("Dining"), List.of()))
                .isInstanceOf(ClassifierException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    private WebClientBatchClassifier classifierReturning(HttpStatus status, String json) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build()));
        return new WebClientBatchClassifier(builder, properties);
    }
}
