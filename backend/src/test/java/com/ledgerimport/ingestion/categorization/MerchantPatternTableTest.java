package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.domain.CategorySource;
import com.ledgerimport.domain.MerchantPattern;
import com.ledgerimport.domain.MerchantPatternRepository;
import com.ledgerimport.domain.SuggestionSource;
import com.ledgerimport.ingestion.config.CategorizationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MerchantPatternTableTest {

    @Mock
    MerchantPatternRepository repository;

    private MerchantPatternTable table;

    @BeforeEach
    void setUp() {
        table = new MerchantPatternTable(repository, new CategorizationProperties());
    }

    @Test
    @DisplayName("direct merchant match ignores case and store numbers")
    void suggest_directMatch() {
        MerchantPatternTable.LocalSuggestion s = table.suggest("STARBUCKS #4411", "STARBUCKS STORE 4411 SEATTLE");

        assertThat(s.suggestion().category()).isEqualTo("Dining");
        assertThat(s.suggestion().confidence()).isEqualTo(75);
        assertThat(s.suggestion().source()).isEqualTo(SuggestionSource.PATTERN);
        assertThat(s.source()).isEqualTo(CategorySource.RULE);
    }

    @Test
    @DisplayName("partial merchant match is penalised by 20")
    void suggest_partialMatch() {
        MerchantPatternTable.LocalSuggestion s = table.suggest(null, "WHOLE FOODS MKT #10234 AUSTIN");

        assertThat(s.suggestion().category()).isEqualTo("Groceries");
        assertThat(s.suggestion().confidence()).isEqualTo(55);
    }

    @Test
    @DisplayName("description keyword falls back to 50")
    void suggest_keyword() {
        MerchantPatternTable.LocalSuggestion s = table.suggest("Joe's Pizza Place", "JOES PIZZA PLACE");

        assertThat(s.suggestion().category()).isEqualTo("Dining");
        assertThat(s.suggestion().confidence()).isEqualTo(50);
        assertThat(s.suggestion().source()).isEqualTo(SuggestionSource.KEYWORD);
    }

    @Test
    void suggest_unknownIsUncategorized() {
        MerchantPatternTable.LocalSuggestion s = table.suggest("Zqx Holdings", "ZQX HOLDINGS 8812");

        assertThat(s.suggestion().isUncategorized()).isTrue();
        assertThat(s.suggestion().confidence()).isZero();
    }

    @Test
    @DisplayName("learned pattern is persisted and wins on the next direct lookup")
    void learn_thenDirectMatch() {
        when(repository.findByMerchantKey("acme store")).thenReturn(Optional.empty());

        table.learn("acme store", "Shopping", 95, 5, 1.0);

        ArgumentCaptor<MerchantPattern> captor = ArgumentCaptor.forClass(MerchantPattern.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getOrigin()).isEqualTo(MerchantPattern.Origin.LEARNED);
        assertThat(table.directMatch("Acme Store", null))
                .hasValueSatisfying(e -> {
                    assertThat(e.category()).isEqualTo("Shopping");
                    assertThat(e.categorySource()).isEqualTo(CategorySource.LEARNED);
                });
    }

    @Test
    void loadLearnedPatterns_overridesSeededDefaults() {
        MerchantPattern p = new MerchantPattern();
        p.setMerchantKey("amazon");
        p.setCategory("Household");
        p.setConfidence(90);
        p.setOrigin(MerchantPattern.Origin.LEARNED);
        when(repository.findAll()).thenReturn(List.of(p));

        table.loadLearnedPatterns();

        assertThat(table.directMatch("AMAZON", null)).hasValueSatisfying(e -> assertThat(e.category()).isEqualTo("Household"));
    }

    @Test
    void keyFor_fallsBackToDescription() {
        assertThat(MerchantPatternTable.keyFor(null, "Acme Store #12")).isEqualTo("acme store");
        assertThat(MerchantPatternTable.keyFor("Acme", "Something else")).isEqualTo("acme");
    }
}
