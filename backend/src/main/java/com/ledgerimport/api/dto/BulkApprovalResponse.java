package com.ledgerimport.api.dto;

import com.ledgerimport.ingestion.pipeline.BulkApprovalResult;

import java.util.List;

public record BulkApprovalResponse(
        int approved,
        int alreadyApproved,
        int failed,
        List<BulkApprovalResult.Failure> failures
) {

    public static BulkApprovalResponse from(BulkApprovalResult result) {
        return new BulkApprovalResponse(result.approved(), result.alreadyApproved(), result.failures().size(),
                result.failures());
    }
}
