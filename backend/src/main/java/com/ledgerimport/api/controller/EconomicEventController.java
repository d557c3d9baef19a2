package com.ledgerimport.api.controller;

import com.ledgerimport.api.dto.CorrectionRequest;
import com.ledgerimport.api.dto.EconomicEventResponse;
import com.ledgerimport.ledger.EconomicEventCorrectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ledger events: read, and correct by appending a correcting event.
 */
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EconomicEventController {

    private final EconomicEventCorrectionService correctionService;

    @GetMapping("/{id}")
    public ResponseEntity<EconomicEventResponse> getEvent(@PathVariable String id) {
        return ResponseEntity.ok(EconomicEventResponse.from(correctionService.getEvent(id)));
    }

    @PostMapping("/{id}/corrections")
    public ResponseEntity<EconomicEventResponse> correct(@PathVariable String id,
                                                         @Valid @RequestBody CorrectionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(EconomicEventResponse.from(
                correctionService.createCorrectionEvent(id, request.toCorrection(), request.reason(), request.actor())));
    }
}
