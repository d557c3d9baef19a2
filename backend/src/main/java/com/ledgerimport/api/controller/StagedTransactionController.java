package com.ledgerimport.api.controller;

import com.ledgerimport.api.dto.ApprovalResponse;
import com.ledgerimport.api.dto.BulkApprovalRequest;
import com.ledgerimport.api.dto.BulkApprovalResponse;
import com.ledgerimport.api.dto.CategoryUpdateRequest;
import com.ledgerimport.api.dto.ReviewNoteRequest;
import com.ledgerimport.api.dto.StagedTransactionResponse;
import com.ledgerimport.ingestion.pipeline.StagedTransactionReviewService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Review decisions on staged transactions. Approving an approved transaction returns 200 with alreadyApproved=true.
 */
@RestController
@RequestMapping("/api/v1/staged-transactions")
@RequiredArgsConstructor
public class StagedTransactionController {

    private final StagedTransactionReviewService reviewService;

    @PostMapping("/{id}/approve")
    public ResponseEntity<ApprovalResponse> approve(@PathVariable String id) {
        return ResponseEntity.ok(ApprovalResponse.from(reviewService.approveTransaction(id)));
    }

    @PostMapping("/approve")
    public ResponseEntity<BulkApprovalResponse> approveBulk(@Valid @RequestBody BulkApprovalRequest request) {
        return ResponseEntity.ok(BulkApprovalResponse.from(reviewService.approveBatch(request.ids())));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<StagedTransactionResponse> reject(@PathVariable String id,
                                                            @Valid @RequestBody(required = false) ReviewNoteRequest request) {
        String reason = request != null ? request.note() : null;
        return ResponseEntity.ok(StagedTransactionResponse.from(reviewService.rejectTransaction(id, reason)));
    }

    @PostMapping("/{id}/flag")
    public ResponseEntity<StagedTransactionResponse> flag(@PathVariable String id,
                                                          @Valid @RequestBody(required = false) ReviewNoteRequest request) {
        String note = request != null ? request.note() : null;
        return ResponseEntity.ok(StagedTransactionResponse.from(reviewService.flagTransaction(id, note)));
    }

    @PutMapping("/{id}/category")
    public ResponseEntity<StagedTransactionResponse> updateCategory(@PathVariable String id,
                                                                    @Valid @RequestBody CategoryUpdateRequest request) {
        return ResponseEntity.ok(StagedTransactionResponse.from(reviewService.updateCategory(
                id, request.category(), request.budgetId(), request.budgetCategoryId(), request.reason())));
    }
}
