package com.ledgerimport.api.controller;

import com.ledgerimport.api.dto.ImportBatchResponse;
import com.ledgerimport.api.dto.ReviewNoteRequest;
import com.ledgerimport.api.dto.StagedTransactionResponse;
import com.ledgerimport.api.dto.StartImportRequest;
import com.ledgerimport.ingestion.pipeline.ImportPipelineOrchestrator;
import com.ledgerimport.ingestion.pipeline.StagedTransactionReviewService;
import com.ledgerimport.ingestion.progress.ImportError;
import com.ledgerimport.ingestion.progress.ImportProgress;
import com.ledgerimport.ingestion.progress.ImportProgressTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Import runs, batch queries, batch rejection and the progress/error event streams.
 */
@RestController
@RequestMapping("/api/v1/imports")
@RequiredArgsConstructor
public class ImportController {

    private final ImportPipelineOrchestrator orchestrator;
    private final StagedTransactionReviewService reviewService;
    private final ImportProgressTracker progressTracker;

    /** Runs the import up to review; the fetch blocks, so it runs off the event loop. */
    @PostMapping
    public Mono<ResponseEntity<ImportBatchResponse>> startImport(@Valid @RequestBody StartImportRequest request) {
        return Mono.fromCallable(() -> orchestrator.executeImport(request.toImportRequest()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(batch -> ResponseEntity.status(HttpStatus.CREATED).body(ImportBatchResponse.from(batch)));
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<ImportBatchResponse> getBatch(@PathVariable String batchId) {
        return ResponseEntity.ok(ImportBatchResponse.from(orchestrator.getBatch(batchId)));
    }

    @GetMapping
    public ResponseEntity<List<ImportBatchResponse>> getBatches(@RequestParam String ownerId) {
        return ResponseEntity.ok(orchestrator.getBatchesForOwner(ownerId).stream()
                .map(ImportBatchResponse::from)
                .toList());
    }

    @GetMapping("/{batchId}/transactions")
    public ResponseEntity<List<StagedTransactionResponse>> getTransactions(@PathVariable String batchId) {
        return ResponseEntity.ok(orchestrator.getStagedTransactionsForBatch(batchId).stream()
                .map(StagedTransactionResponse::from)
                .toList());
    }

    @PostMapping("/{batchId}/reject")
    public ResponseEntity<ImportBatchResponse> rejectBatch(@PathVariable String batchId,
                                                           @Valid @RequestBody(required = false) ReviewNoteRequest request) {
        String reason = request != null ? request.note() : null;
        return ResponseEntity.ok(ImportBatchResponse.from(reviewService.rejectBatch(batchId, reason)));
    }

    @GetMapping(value = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ImportProgress>> progress(@RequestParam(required = false) String batchId) {
        return progressTracker.progressStream()
                .filter(p -> batchId == null || batchId.equals(p.batchId()))
                .map(p -> ServerSentEvent.builder(p).event("progress").build());
    }

    @GetMapping(value = "/errors", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ImportError>> errors(@RequestParam(required = false) String batchId) {
        return progressTracker.errorStream()
                .filter(e -> batchId == null || batchId.equals(e.batchId()))
                .map(e -> ServerSentEvent.builder(e).event("import-error").build());
    }
}
