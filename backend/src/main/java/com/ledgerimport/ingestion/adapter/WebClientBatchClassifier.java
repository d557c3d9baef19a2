package com.ledgerimport.ingestion.adapter;

import com.ledgerimport.ingestion.config.ClassifierProperties;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP classifier client: POST /classify with transactions, allowed categories and few-shot examples.
 * Every failure, an undecodable 200 body included, surfaces as {@link ClassifierException}.
 */
public class WebClientBatchClassifier implements BatchClassifier {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientBatchClassifier(WebClient.Builder builder, ClassifierProperties properties) {
        WebClient.Builder b = builder.baseUrl(properties.getBaseUrl());
        if (properties.getApiKey() != null) {
            b = b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        this.webClient = b.build();
        this.timeout = Duration.ofMillis(properties.getTimeoutMs());
    }

    @Override
    public List<ClassificationResult> classify(List<ClassificationItem> transactions, List<String> categories,
                                               List<ClassificationExample> examples) {
        Map<String, Object> body = Map.of(
                "transactions", transactions,
                "categories", categories,
                "examples", examples);
        ClassifyResponse response = webClient.post()
                .uri("/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ClassifyResponse.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new ClassifierException("Classifier returned " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class, e -> new ClassifierException(e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new ClassifierException("Classifier call timed out", e))
                .onErrorMap(CodecException.class, e -> new ClassifierException("Unreadable classifier response: " + e.getMessage(), e))
                .onErrorMap(e -> !(e instanceof ClassifierException), e -> new ClassifierException("Classifier call failed: " + e.getMessage(), e))
                .block();
        if (response == null || response.results() == null) {
            throw new ClassifierException("Classifier returned no results");
        }
        return response.results();
    }

    record ClassifyResponse(List<ClassificationResult> results) {
    }
}
