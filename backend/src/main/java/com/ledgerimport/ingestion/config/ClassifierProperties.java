package com.ledgerimport.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * External batch classifier. Disabled by default; categorization then relies on rules and the merchant table.
 */
@ConfigurationProperties(prefix = "ledgerimport.classifier")
@NoArgsConstructor
@Getter
@Setter
public class ClassifierProperties {

    private boolean enabled;
    private String baseUrl;
    private String apiKey;

    /** Per-chunk call deadline. */
    private long timeoutMs = 15_000;

    /** Transactions per classifier call. */
    private int chunkSize = 50;

    /** Recent corrections sent as few-shot examples. */
    private int maxExamples = 20;

    /** Offered to the classifier in addition to the owner's budget category names. */
    private List<String> defaultCategories = new ArrayList<>(List.of(
            "Groceries", "Dining", "Shopping", "Transportation", "Utilities", "Entertainment",
            "Healthcare", "Housing", "Income", "Fees", "Transfers", "Travel"));
}
