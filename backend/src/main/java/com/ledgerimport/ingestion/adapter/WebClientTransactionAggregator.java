package com.ledgerimport.ingestion.adapter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerimport.common.RetryPolicy;
import com.ledgerimport.domain.AggregatorConnection;
import com.ledgerimport.domain.DateRange;
import com.ledgerimport.domain.ExternalTransaction;
import com.ledgerimport.ingestion.config.AggregatorProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Cursor-paginated aggregator client over WebClient. Each page call waits for a local rate-limiter permit and is
 * retried with backoff on transient failures; the whole fetch is bounded by the caller's deadline.
 */
@Slf4j
public class WebClientTransactionAggregator implements TransactionAggregator {

    private static final String SYNC_PATH = "/transactions/sync";
    private static final TypeReference<Map<String, Object>> RAW_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AggregatorProperties properties;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;

    public WebClientTransactionAggregator(WebClient.Builder builder, ObjectMapper objectMapper,
                                          AggregatorProperties properties, RetryPolicy retryPolicy,
                                          RateLimiter rateLimiter) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public List<ExternalTransaction> fetch(AggregatorConnection connection, DateRange range, Duration deadline) {
        Instant deadlineAt = Instant.now().plus(deadline);
        Set<String> accounts = new HashSet<>(connection.getAccountIds());
        List<ExternalTransaction> all = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        boolean hasMore;
        do {
            JsonNode page = fetchPageWithRetry(connection, range, cursor, deadlineAt);
            pages++;
            for (JsonNode node : page.path("added")) {
                ExternalTransaction txn = toExternal(node);
                if (!accounts.isEmpty() && txn.accountId() != null && !accounts.contains(txn.accountId())) {
                    continue;
                }
                if (txn.date() != null && (txn.date().isBefore(range.start()) || txn.date().isAfter(range.end()))) {
                    continue;
                }
                all.add(txn);
            }
            cursor = page.path("next_cursor").asText(null);
            hasMore = page.path("has_more").asBoolean(false) && cursor != null && !cursor.isBlank();
        } while (hasMore);
        log.info("Fetched {} transactions in {} page(s) for connection {}", all.size(), pages, connection.getId());
        return all;
    }

    private JsonNode fetchPageWithRetry(AggregatorConnection connection, DateRange range, String cursor, Instant deadlineAt) {
        AggregatorException last = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(Math.min(retryPolicy.delayMs(attempt - 1), remaining(deadlineAt).toMillis()));
            }
            Duration remaining = remaining(deadlineAt);
            if (remaining.isZero()) {
                throw new AggregatorException("Fetch deadline exceeded", false, last);
            }
            try {
                return fetchPage(connection, range, cursor, remaining);
            } catch (AggregatorException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
                log.warn("Aggregator page call failed (attempt {}/{}): {}", attempt + 1, retryPolicy.getMaxAttempts(), e.getMessage());
            }
        }
        throw new AggregatorException("Aggregator unavailable after " + retryPolicy.getMaxAttempts() + " attempts", false, last);
    }

    private JsonNode fetchPage(AggregatorConnection connection, DateRange range, String cursor, Duration timeout) {
        if (!rateLimiter.acquirePermission()) {
            throw new AggregatorException("Local rate limiter timeout before page request", true);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("client_id", properties.getClientId());
        body.put("secret", properties.getSecret());
        body.put("access_token", connection.getAccessToken());
        body.put("start_date", range.start().toString());
        body.put("end_date", range.end().toString());
        body.put("count", properties.getPageSize());
        if (cursor != null) {
            body.put("cursor", cursor);
        }
        JsonNode page = webClient.post()
                .uri(SYNC_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class, e -> new AggregatorException(
                        "Aggregator returned " + e.getStatusCode().value(),
                        e.getStatusCode().value() == 429 || e.getStatusCode().is5xxServerError(), e))
                .onErrorMap(WebClientRequestException.class, e -> new AggregatorException(e.getMessage(), true, e))
                .onErrorMap(TimeoutException.class, e -> new AggregatorException("Aggregator page call timed out", true, e))
                .block();
        if (page == null) {
            throw new AggregatorException("Empty aggregator response", true);
        }
        return page;
    }

    ExternalTransaction toExternal(JsonNode node) {
        BigDecimal amount = node.hasNonNull("amount") ? node.get("amount").decimalValue() : null;
        if (amount != null && properties.isOutflowPositive()) {
            amount = amount.negate();
        }
        return new ExternalTransaction(
                text(node, "transaction_id"),
                text(node, "account_id"),
                amount,
                text(node, "iso_currency_code"),
                parseDate(text(node, "date")),
                text(node, "name"),
                text(node, "merchant_name"),
                node.path("pending").asBoolean(false),
                objectMapper.convertValue(node, RAW_TYPE));
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable transaction date {}", value);
            return null;
        }
    }

    private static Duration remaining(Instant deadlineAt) {
        Duration d = Duration.between(Instant.now(), deadlineAt);
        return d.isNegative() ? Duration.ZERO : d;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(Math.max(0L, ms));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AggregatorException("Interrupted during retry", false, e);
        }
    }
}
