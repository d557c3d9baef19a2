package com.ledgerimport.ingestion.adapter;

import java.util.List;

/**
 * External batch categorization model. Responses may be partial; callers fill gaps locally.
 */
public interface BatchClassifier {

    /**
     * @param transactions items to classify
     * @param categories   allowed category names
     * @param examples     recent human corrections, used as few-shot examples
     * @throws ClassifierException on transport failure, timeout or an unusable response
     */
    List<ClassificationResult> classify(List<ClassificationItem> transactions, List<String> categories,
                                        List<ClassificationExample> examples);

    /** False when no classifier is configured; callers go straight to local rules. */
    default boolean isAvailable() {
        return true;
    }

    record ClassificationItem(String transactionId, String description, String merchantName, String amount, String kind) {
    }

    record ClassificationExample(String description, String merchantName, String category) {
    }

    record ClassificationResult(String transactionId, String category, int confidence, String reasoning,
                                List<Alternative> alternatives) {
    }

    record Alternative(String category, int confidence) {
    }
}
