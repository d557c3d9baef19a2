package com.ledgerimport.ingestion.adapter;

import java.util.List;

/**
 * Used when ledgerimport.classifier.enabled=false.
 */
public class DisabledBatchClassifier implements BatchClassifier {

    @Override
    public List<ClassificationResult> classify(List<ClassificationItem> transactions, List<String> categories,
                                               List<ClassificationExample> examples) {
        throw new ClassifierException("External classifier is disabled");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
