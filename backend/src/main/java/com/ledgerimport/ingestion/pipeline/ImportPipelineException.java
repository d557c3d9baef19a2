package com.ledgerimport.ingestion.pipeline;

import lombok.Getter;

/**
 * Fatal failure of an import run. The batch stays at its last successful stage.
 */
@Getter
public class ImportPipelineException extends RuntimeException {

    public static final String CONNECTION_NOT_FOUND = "CONNECTION_NOT_FOUND";
    public static final String FETCH_FAILED = "FETCH_FAILED";
    public static final String STAGING_FAILED = "STAGING_FAILED";

    private final String errorCode;
    private final String batchId;

    public ImportPipelineException(String errorCode, String batchId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.batchId = batchId;
    }

    public ImportPipelineException(String errorCode, String batchId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.batchId = batchId;
    }
}
