package com.ledgerimport.ingestion.normalizer;

import java.util.List;

/**
 * Output of normalizing a fetched page set: valid transactions plus the ids/messages of rejected records.
 */
public record NormalizationResult(List<NormalizedTransaction> transactions, List<String> rejections) {

    public int errorCount() {
        return rejections.size();
    }
}
