package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.domain.AutoRuleEligibleEvent;
import com.ledgerimport.domain.CategorySource;
import com.ledgerimport.domain.CorrectionRecord;
import com.ledgerimport.domain.CorrectionRecordRepository;
import com.ledgerimport.domain.MerchantPatternRepository;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.ingestion.config.CategorizationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CorrectionLearnerTest {

    @Mock
    CorrectionRecordRepository correctionRecordRepository;
    @Mock
    MerchantPatternRepository merchantPatternRepository;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private final List<CorrectionRecord> history = new ArrayList<>();
    private MerchantPatternTable table;
    private CorrectionLearner learner;

    @BeforeEach
    void setUp() {
        table = new MerchantPatternTable(merchantPatternRepository, new CategorizationProperties());
        learner = new CorrectionLearner(correctionRecordRepository, table, new CategorizationProperties(), applicationEventPublisher);
        lenient().when(correctionRecordRepository.save(any(CorrectionRecord.class))).thenAnswer(inv -> {
            CorrectionRecord r = inv.getArgument(0);
            if (r.getId() == null) {
                r.setId("c" + history.size());
                history.add(r);
            }
            return r;
        });
        lenient().when(correctionRecordRepository.findByMerchantKey("acme store")).thenAnswer(inv -> new ArrayList<>(history));
        lenient().when(merchantPatternRepository.findByMerchantKey("acme store")).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("five agreeing corrections for Acme Store learn Shopping at 85 or more")
    void fiveCorrections_learnPattern() {
        for (int i = 0; i < 4; i++) {
            CorrectionRecord r = learner.recordCorrection(acme("s" + i), "Shopping", null);
            assertThat(r.isRuleEligible()).isFalse();
        }
        assertThat(table.directMatch("Acme Store", null)).isEmpty();

        CorrectionRecord fifth = learner.recordCorrection(acme("s4"), "Shopping", "always shopping");

        assertThat(fifth.isRuleEligible()).isTrue();
        assertThat(table.directMatch("ACME STORE #7", null)).hasValueSatisfying(e -> {
            assertThat(e.category()).isEqualTo("Shopping");
            assertThat(e.confidence()).isGreaterThanOrEqualTo(85);
            assertThat(e.categorySource()).isEqualTo(CategorySource.LEARNED);
        });
        ArgumentCaptor<AutoRuleEligibleEvent> event = ArgumentCaptor.forClass(AutoRuleEligibleEvent.class);
        verify(applicationEventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().merchantKey()).isEqualTo("acme store");
        assertThat(event.getValue().correctionCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("a contradicting correction blocks learning until agreement exceeds 90%")
    void contradiction_requiresHighAgreement() {
        learner.recordCorrection(acme("x"), "Groceries", null);
        for (int i = 0; i < 9; i++) {
            learner.recordCorrection(acme("s" + i), "Shopping", null);
        }
        // 9 of 10 = 0.90, not above the ratio
        assertThat(table.directMatch("Acme Store", null)).isEmpty();

        learner.recordCorrection(acme("s9"), "Shopping", null);

        assertThat(table.directMatch("Acme Store", null))
                .hasValueSatisfying(e -> assertThat(e.confidence()).isEqualTo(CorrectionLearner.learnedConfidence(10.0 / 11)));
    }

    @Test
    void recordCorrection_keepsBeforeState() {
        StagedTransaction before = acme("s1");
        before.setCategory("Uncategorized");
        before.setCategoryConfidence(0);

        CorrectionRecord r = learner.recordCorrection(before, "Shopping", "wrong");

        assertThat(r.getOriginalCategory()).isEqualTo("Uncategorized");
        assertThat(r.getCorrectedCategory()).isEqualTo("Shopping");
        assertThat(r.getMerchantKey()).isEqualTo("acme store");
        verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void learnedConfidence_isClamped() {
        assertThat(CorrectionLearner.learnedConfidence(1.0)).isEqualTo(95);
        assertThat(CorrectionLearner.learnedConfidence(0.5)).isEqualTo(85);
    }

    private static StagedTransaction acme(String id) {
        StagedTransaction s = new StagedTransaction();
        s.setId(id);
        s.setOwnerId("owner-1");
        s.setMerchantName("Acme Store");
        s.setDescription("ACME STORE #7");
        s.setCategory("Other");
        s.setCategoryConfidence(50);
        s.setCategorySource(CategorySource.RULE);
        return s;
    }
}
