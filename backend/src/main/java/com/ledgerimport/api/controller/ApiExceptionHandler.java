package com.ledgerimport.api.controller;

import com.ledgerimport.api.dto.ErrorBody;
import com.ledgerimport.ingestion.pipeline.ImportPipelineException;
import com.ledgerimport.ingestion.store.StagedTransactionException;
import com.ledgerimport.ledger.EconomicEventException;
import com.ledgerimport.reconciliation.ReconciliationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;
import java.util.Set;

/**
 * Maps validation failures to 400 and domain error codes to HTTP status, all with ErrorBody (error, message,
 * timestamp). Codes ending in _NOT_FOUND are 404; review and ledger conflicts are 409.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final Set<String> CONFLICTS = Set.of(
            StagedTransactionException.DUPLICATE_NOT_APPROVABLE,
            StagedTransactionException.INVALID_REVIEW_TRANSITION,
            EconomicEventException.NOT_APPROVED,
            EconomicEventException.EVENT_ALREADY_CREATED,
            EconomicEventException.EVENT_ALREADY_CORRECTED);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getGlobalError())
                .map(e -> e.getDefaultMessage())
                .or(() -> Optional.ofNullable(ex.getFieldError()).map(FieldError::getDefaultMessage))
                .filter(msg -> msg != null && msg.matches("[A-Z_]+"))
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(StagedTransactionException.class)
    public ResponseEntity<ErrorBody> handleStaged(StagedTransactionException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(EconomicEventException.class)
    public ResponseEntity<ErrorBody> handleEvent(EconomicEventException ex) {
        if (EconomicEventException.EVENT_ALREADY_CREATED.equals(ex.getErrorCode())) {
            log.warn("Event integrity conflict: {}", ex.getMessage());
        }
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorBody> handleReconciliation(ReconciliationException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ImportPipelineException.class)
    public ResponseEntity<ErrorBody> handlePipeline(ImportPipelineException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    static HttpStatus statusFor(String errorCode) {
        if (errorCode == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (errorCode.endsWith("_NOT_FOUND")) {
            return HttpStatus.NOT_FOUND;
        }
        if (CONFLICTS.contains(errorCode)) {
            return HttpStatus.CONFLICT;
        }
        return switch (errorCode) {
            case ImportPipelineException.FETCH_FAILED -> HttpStatus.BAD_GATEWAY;
            case EconomicEventException.INVALID_CORRECTION -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorBody> respond(String errorCode, String message) {
        return ResponseEntity.status(statusFor(errorCode)).body(ErrorBody.of(errorCode, message));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_DATE_RANGE" -> "startDate and endDate are required, in order, at most two years apart";
            case "OWNER_REQUIRED" -> "ownerId is required";
            case "CONNECTION_REQUIRED" -> "connectionId is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
