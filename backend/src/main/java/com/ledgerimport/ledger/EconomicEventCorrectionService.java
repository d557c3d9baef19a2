package com.ledgerimport.ledger;

import com.ledgerimport.domain.EconomicEvent;
import com.ledgerimport.domain.EconomicEventRepository;
import com.ledgerimport.domain.EventState;
import com.ledgerimport.reconciliation.BudgetReconciler;
import com.ledgerimport.reconciliation.ReconciliationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Corrects ledger events by appending a new event that references the original. The original keeps its economic
 * fields and is only flagged CORRECTED. A changed amount is reconciled as a delta against the original's budget
 * category. A move to another budget category takes the original amount out of the old category and puts the
 * corrected amount into the new one. Changing only the category name leaves the budget linkage as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EconomicEventCorrectionService {

    private final EconomicEventRepository economicEventRepository;
    private final BudgetReconciler budgetReconciler;

    public EconomicEvent getEvent(String eventId) {
        return economicEventRepository.findById(eventId)
                .orElseThrow(() -> new EconomicEventException(EconomicEventException.EVENT_NOT_FOUND,
                        "Economic event not found: " + eventId));
    }

    /**
     * @param actor who requested the correction; becomes the new event's creator
     * @throws EconomicEventException  EVENT_NOT_FOUND, EVENT_ALREADY_CORRECTED or INVALID_CORRECTION
     * @throws ReconciliationException the target budget category does not exist; nothing is written then
     */
    public EconomicEvent createCorrectionEvent(String originalEventId, EventCorrection correction,
                                               CorrectionReason reason, String actor) {
        if (correction == null || reason == null) {
            throw new EconomicEventException(EconomicEventException.INVALID_CORRECTION, "Correction and reason are required");
        }
        if (correction.quantity() != null && correction.quantity().signum() < 0) {
            throw new EconomicEventException(EconomicEventException.INVALID_CORRECTION, "Quantity must not be negative");
        }
        EconomicEvent original = getEvent(originalEventId);
        if (original.getState() == EventState.CORRECTED) {
            throw alreadyCorrected(originalEventId);
        }
        BudgetLink from = BudgetLink.of(original);
        BudgetLink to = from.with(correction);
        if (!to.equals(from)) {
            if (!to.isComplete()) {
                throw new EconomicEventException(EconomicEventException.INVALID_CORRECTION,
                        "Moving an event needs both a budget and a budget category");
            }
            budgetReconciler.requireCategory(to.budgetId(), to.categoryId());
        }

        EconomicEvent corrected;
        try {
            corrected = economicEventRepository.insert(buildCorrection(original, correction, reason, actor));
        } catch (DuplicateKeyException e) {
            throw alreadyCorrected(originalEventId);
        }
        if (!economicEventRepository.markCorrected(originalEventId)) {
            log.warn("Event {} was already flagged CORRECTED when correction {} was appended", originalEventId, corrected.getId());
        }
        log.info("Event {} corrected by {} ({})", originalEventId, corrected.getId(), reason);

        reconcile(original, corrected, from, to);
        return corrected;
    }

    private void reconcile(EconomicEvent original, EconomicEvent corrected, BudgetLink from, BudgetLink to) {
        if (to.equals(from)) {
            BigDecimal delta = corrected.getQuantity().subtract(original.getQuantity());
            if (delta.signum() != 0 && from.isComplete()) {
                budgetReconciler.reconcileAdjustment(from.budgetId(), from.categoryId(), delta, corrected.getId());
            }
            return;
        }
        budgetReconciler.reconcileAdjustment(to.budgetId(), to.categoryId(), corrected.getQuantity(), corrected.getId());
        if (from.isComplete()) {
            budgetReconciler.reconcileAdjustment(from.budgetId(), from.categoryId(), original.getQuantity().negate(),
                    corrected.getId());
        }
        log.info("Event {} moved from {}/{} to {}/{}", original.getId(), from.budgetId(), from.categoryId(),
                to.budgetId(), to.categoryId());
    }

    private static EconomicEvent buildCorrection(EconomicEvent original, EventCorrection correction,
                                                 CorrectionReason reason, String actor) {
        EconomicEvent e = new EconomicEvent();
        e.setEventType(original.getEventType());
        e.setAction(original.getAction());
        e.setOccurredAt(correction.occurredAt() != null ? correction.occurredAt() : original.getOccurredAt());
        e.setProviderId(correction.providerId() != null ? correction.providerId() : original.getProviderId());
        e.setReceiverId(correction.receiverId() != null ? correction.receiverId() : original.getReceiverId());
        e.setQuantity(correction.quantity() != null ? correction.quantity() : original.getQuantity());
        e.setUnit(original.getUnit());
        e.setNote(correction.note() != null ? correction.note() : original.getNote());
        Map<String, Object> metadata = new LinkedHashMap<>(original.getMetadata());
        metadata.remove("stagedTransactionId");
        if (correction.category() != null) {
            metadata.put("category", correction.category());
            metadata.put("categorySource", "MANUAL");
        }
        if (correction.budgetId() != null) {
            metadata.put("budgetId", correction.budgetId());
        }
        if (correction.budgetCategoryId() != null) {
            metadata.put("budgetCategoryId", correction.budgetCategoryId());
        }
        metadata.put("correctedFromEventId", original.getId());
        e.setMetadata(metadata);
        e.setState(EventState.VALIDATED);
        e.setCorrectsEventId(original.getId());
        e.setCorrectionReason(reason.name());
        e.setCreatedBy(actor != null ? actor : original.getCreatedBy());
        e.setCreatedAt(Instant.now());
        return e;
    }

    private static EconomicEventException alreadyCorrected(String eventId) {
        return new EconomicEventException(EconomicEventException.EVENT_ALREADY_CORRECTED,
                "Event " + eventId + " was already corrected; correct the newest event instead");
    }

    private record BudgetLink(String budgetId, String categoryId) {

        static BudgetLink of(EconomicEvent event) {
            return new BudgetLink((String) event.getMetadata().get("budgetId"),
                    (String) event.getMetadata().get("budgetCategoryId"));
        }

        BudgetLink with(EventCorrection correction) {
            return new BudgetLink(
                    correction.budgetId() != null ? correction.budgetId() : budgetId,
                    correction.budgetCategoryId() != null ? correction.budgetCategoryId() : categoryId);
        }

        boolean isComplete() {
            return budgetId != null && categoryId != null;
        }
    }
}
