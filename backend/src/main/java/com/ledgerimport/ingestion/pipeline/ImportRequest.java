package com.ledgerimport.ingestion.pipeline;

import com.ledgerimport.domain.DateRange;

import java.time.Duration;
import java.util.List;

/**
 * Parameters of one import run.
 *
 * @param accountIds         accounts to import; empty means every account of the connection
 * @param categorize         dispatch background categorization once staged
 * @param skipDuplicateCheck stage everything without consulting the registry
 * @param fetchTimeout       overrides {@code ledgerimport.aggregator.fetch-timeout-ms} when set
 */
public record ImportRequest(
        String ownerId,
        String connectionId,
        List<String> accountIds,
        DateRange dateRange,
        boolean categorize,
        boolean skipDuplicateCheck,
        DuplicateHandling duplicateHandling,
        Duration fetchTimeout
) {

    public ImportRequest {
        accountIds = accountIds == null ? List.of() : List.copyOf(accountIds);
        duplicateHandling = duplicateHandling == null ? DuplicateHandling.DROP : duplicateHandling;
    }

    public static ImportRequest of(String ownerId, String connectionId, DateRange dateRange) {
        return new ImportRequest(ownerId, connectionId, List.of(), dateRange, true, false, DuplicateHandling.DROP, null);
    }

    public enum DuplicateHandling {
        /** Suspected duplicates are counted and not staged. */
        DROP,
        /** Suspected duplicates are staged flagged and parked in NEEDS_ATTENTION. */
        FLAG
    }
}
