package com.ledgerimport.ingestion.adapter;

import com.ledgerimport.domain.AggregatorConnection;
import com.ledgerimport.domain.DateRange;
import com.ledgerimport.domain.ExternalTransaction;

import java.time.Duration;
import java.util.List;

/**
 * Source of external transactions for a linked connection. Results are untrusted: records may be malformed.
 */
public interface TransactionAggregator {

    /**
     * Fetch every transaction in {@code range} for the connection's accounts, following pagination.
     *
     * @param deadline upper bound for the whole fetch, all pages and retries included
     * @throws AggregatorException on transport failure, provider error or deadline expiry
     */
    List<ExternalTransaction> fetch(AggregatorConnection connection, DateRange range, Duration deadline);
}
