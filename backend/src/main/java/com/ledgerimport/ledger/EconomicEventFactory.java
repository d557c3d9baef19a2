package com.ledgerimport.ledger;

import com.ledgerimport.domain.EconomicAction;
import com.ledgerimport.domain.EconomicEvent;
import com.ledgerimport.domain.EconomicEventRepository;
import com.ledgerimport.domain.EconomicEventType;
import com.ledgerimport.domain.EventState;
import com.ledgerimport.domain.ReviewStatus;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.domain.StagedTransactionRepository;
import com.ledgerimport.domain.TransactionKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an approved staged transaction into an immutable ledger event and links it back. The unique index on
 * {@code stagedTransactionId} plus the conditional link make creation at-most-once per staged transaction.
 *
 * <p>Agents: credit has the counterparty as provider and the owner as receiver; debit, fee and transfer have the
 * owner as provider and the merchant (or a placeholder) as receiver.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EconomicEventFactory {

    public static final String EXTERNAL_PARTY = "external-party";
    public static final String FEE_COLLECTOR = "fee-collector";
    public static final String EXTERNAL_ACCOUNT = "external-account";
    public static final String SOURCE = "aggregator-import";
    static final String FACTORY_ID = "staged-transaction-factory/1";

    private final EconomicEventRepository economicEventRepository;
    private final StagedTransactionRepository stagedTransactionRepository;

    /**
     * @throws EconomicEventException NOT_APPROVED if the transaction is not approved, EVENT_ALREADY_CREATED if it
     *                                already has (or races to) an event
     */
    public EconomicEvent createFromStaged(StagedTransaction staged) {
        if (staged.getReviewStatus() != ReviewStatus.APPROVED) {
            throw new EconomicEventException(EconomicEventException.NOT_APPROVED,
                    "Cannot create event from non-approved transaction " + staged.getId() + " (" + staged.getReviewStatus() + ")");
        }
        if (staged.getEconomicEventId() != null) {
            throw new EconomicEventException(EconomicEventException.EVENT_ALREADY_CREATED,
                    "Economic event already created for transaction " + staged.getId() + ": " + staged.getEconomicEventId());
        }
        EconomicEvent event;
        try {
            event = economicEventRepository.insert(build(staged));
        } catch (DuplicateKeyException e) {
            throw new EconomicEventException(EconomicEventException.EVENT_ALREADY_CREATED,
                    "Economic event already created for transaction " + staged.getId());
        }
        if (!stagedTransactionRepository.linkEconomicEvent(staged.getId(), event.getId())) {
            log.error("Event {} created but staged transaction {} could not be linked", event.getId(), staged.getId());
            throw new EconomicEventException(EconomicEventException.EVENT_ALREADY_CREATED,
                    "Staged transaction " + staged.getId() + " is already linked to an economic event");
        }
        staged.setEconomicEventId(event.getId());
        log.info("Created {} event {} for staged transaction {}", event.getEventType(), event.getId(), staged.getId());
        return event;
    }

    /**
     * Create events for each transaction, skipping the ones that fail.
     *
     * @return only the events actually created
     */
    public List<EconomicEvent> createMultipleFromStaged(List<StagedTransaction> stagedTransactions) {
        List<EconomicEvent> created = new ArrayList<>();
        for (StagedTransaction staged : stagedTransactions) {
            try {
                created.add(createFromStaged(staged));
            } catch (EconomicEventException e) {
                log.warn("Skipping staged transaction {}: {}", staged.getId(), e.getMessage());
            }
        }
        return created;
    }

    EconomicEvent build(StagedTransaction staged) {
        EconomicEvent e = new EconomicEvent();
        boolean retire = staged.getKind() == TransactionKind.FEE;
        e.setEventType(retire ? EconomicEventType.RETIRE : EconomicEventType.TRANSFER);
        e.setAction(retire ? EconomicAction.CONSUME : EconomicAction.TRANSFER);
        e.setOccurredAt(staged.getTimestamp());
        e.setProviderId(provider(staged));
        e.setReceiverId(receiver(staged));
        e.setQuantity(staged.getAmount());
        e.setUnit(staged.getCurrency());
        e.setNote(note(staged));
        e.setMetadata(metadata(staged));
        e.setState(EventState.VALIDATED);
        e.setStagedTransactionId(staged.getId());
        e.setCreatedBy(staged.getOwnerId());
        e.setCreatedAt(Instant.now());
        return e;
    }

    private static String provider(StagedTransaction staged) {
        if (staged.getKind() == TransactionKind.CREDIT) {
            return hasText(staged.getMerchantName()) ? staged.getMerchantName() : EXTERNAL_PARTY;
        }
        return staged.getOwnerId();
    }

    private static String receiver(StagedTransaction staged) {
        return switch (staged.getKind()) {
            case CREDIT -> staged.getOwnerId();
            case DEBIT -> hasText(staged.getMerchantName()) ? staged.getMerchantName() : EXTERNAL_PARTY;
            case FEE -> hasText(staged.getMerchantName()) ? staged.getMerchantName() : FEE_COLLECTOR;
            case TRANSFER -> EXTERNAL_ACCOUNT;
        };
    }

    static String note(StagedTransaction staged) {
        StringBuilder sb = new StringBuilder();
        String merchant = staged.getMerchantName();
        String description = staged.getDescription();
        if (hasText(merchant)) {
            sb.append(merchant);
            if (hasText(description) && !description.equalsIgnoreCase(merchant)) {
                sb.append(": ").append(description);
            }
        } else if (hasText(description)) {
            sb.append(description);
        }
        sb.append(" (from account ").append(staged.getExternalAccountId()).append(')');
        return sb.toString();
    }

    private static Map<String, Object> metadata(StagedTransaction staged) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("externalTransactionId", staged.getExternalTransactionId());
        m.put("externalAccountId", staged.getExternalAccountId());
        m.put("category", staged.getCategory());
        m.put("categoryConfidence", staged.getCategoryConfidence());
        m.put("categorySource", staged.getCategorySource() == null ? null : staged.getCategorySource().name());
        m.put("budgetId", staged.getBudgetId());
        m.put("budgetCategoryId", staged.getBudgetCategoryId());
        m.put("importBatchId", staged.getBatchId());
        m.put("merchantName", staged.getMerchantName());
        m.put("transactionKind", staged.getKind().name());
        m.put("rawPayload", staged.getRawPayload());
        m.put("source", SOURCE);
        m.put("stagedTransactionId", staged.getId());
        m.put("eventFactory", FACTORY_ID);
        return m;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
