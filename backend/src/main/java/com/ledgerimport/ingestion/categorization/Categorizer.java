package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.domain.CategoryAssignment;
import com.ledgerimport.domain.CategorySource;
import com.ledgerimport.domain.CategorySuggestion;
import com.ledgerimport.domain.CorrectionRecord;
import com.ledgerimport.domain.CorrectionRecordRepository;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.domain.SuggestionSource;
import com.ledgerimport.domain.TransactionRule;
import com.ledgerimport.domain.TransactionRuleRepository;
import com.ledgerimport.ingestion.adapter.BatchClassifier;
import com.ledgerimport.ingestion.adapter.BatchClassifier.ClassificationExample;
import com.ledgerimport.ingestion.adapter.BatchClassifier.ClassificationItem;
import com.ledgerimport.ingestion.adapter.BatchClassifier.ClassificationResult;
import com.ledgerimport.ingestion.adapter.ClassifierException;
import com.ledgerimport.ingestion.config.ClassifierProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Assigns categories to staged transactions. Order: authored rules, direct merchant pattern, external batch
 * classifier (with recent corrections as examples), then the local merchant/keyword fallback for anything the
 * classifier failed on or left out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Categorizer {

    static final int RULE_CONFIDENCE = 90;

    private final TransactionRuleRepository transactionRuleRepository;
    private final CorrectionRecordRepository correctionRecordRepository;
    private final RuleMatcher ruleMatcher;
    private final MerchantPatternTable merchantPatternTable;
    private final CategoryCatalog categoryCatalog;
    private final BatchClassifier batchClassifier;
    private final ClassifierProperties classifierProperties;

    /**
     * Categorize one chunk of an owner's transactions.
     *
     * @return assignment per staged transaction id, one for every input
     */
    public Map<String, CategoryAssignment> categorize(String ownerId, List<StagedTransaction> transactions) {
        Map<String, CategoryAssignment> assignments = new LinkedHashMap<>();
        List<TransactionRule> rules = transactionRuleRepository.findByOwnerIdAndEnabledTrueOrderByPriorityDesc(ownerId);
        List<StagedTransaction> unresolved = new ArrayList<>();
        for (StagedTransaction txn : transactions) {
            Optional<TransactionRule> rule = ruleMatcher.firstMatch(rules, txn);
            if (rule.isPresent()) {
                assignments.put(txn.getId(), fromRule(rule.get()));
                continue;
            }
            Optional<MerchantPatternTable.Entry> pattern = merchantPatternTable.directMatch(txn.getMerchantName(), txn.getDescription());
            if (pattern.isPresent()) {
                MerchantPatternTable.LocalSuggestion local = pattern.get().toSuggestion();
                assignments.put(txn.getId(), CategoryAssignment.of(local.suggestion(), local.source()));
                continue;
            }
            unresolved.add(txn);
        }
        if (!unresolved.isEmpty()) {
            assignments.putAll(classify(ownerId, unresolved));
        }
        return assignments;
    }

    private Map<String, CategoryAssignment> classify(String ownerId, List<StagedTransaction> transactions) {
        if (!batchClassifier.isAvailable()) {
            return fallback(transactions);
        }
        List<ClassificationResult> results;
        try {
            results = batchClassifier.classify(
                    transactions.stream().map(Categorizer::toItem).toList(),
                    categoryCatalog.categoriesFor(ownerId),
                    examples(ownerId));
        } catch (ClassifierException e) {
            log.warn("External classifier failed for {} transaction(s), using local rules: {}", transactions.size(), e.getMessage());
            return fallback(transactions);
        }
        Map<String, ClassificationResult> byId = results.stream()
                .filter(r -> r.transactionId() != null && r.category() != null && !r.category().isBlank())
                .collect(Collectors.toMap(ClassificationResult::transactionId, Function.identity(), (a, b) -> a));
        Map<String, CategoryAssignment> assignments = new LinkedHashMap<>();
        List<StagedTransaction> missing = new ArrayList<>();
        for (StagedTransaction txn : transactions) {
            ClassificationResult result = byId.get(txn.getId());
            if (result == null) {
                missing.add(txn);
            } else {
                assignments.put(txn.getId(), fromClassifier(result));
            }
        }
        if (!missing.isEmpty()) {
            log.debug("Classifier omitted {} transaction(s); categorizing locally", missing.size());
            assignments.putAll(fallback(missing));
        }
        return assignments;
    }

    private Map<String, CategoryAssignment> fallback(List<StagedTransaction> transactions) {
        Map<String, CategoryAssignment> assignments = new LinkedHashMap<>();
        for (StagedTransaction txn : transactions) {
            MerchantPatternTable.LocalSuggestion local = merchantPatternTable.suggest(txn.getMerchantName(), txn.getDescription());
            assignments.put(txn.getId(), CategoryAssignment.of(local.suggestion(), local.source()));
        }
        return assignments;
    }

    private List<ClassificationExample> examples(String ownerId) {
        List<CorrectionRecord> recent = correctionRecordRepository.findByOwnerIdOrderByCorrectedAtDesc(
                ownerId, PageRequest.of(0, Math.max(1, classifierProperties.getMaxExamples())));
        return recent.stream()
                .map(c -> new ClassificationExample(c.getDescription(), c.getMerchantName(), c.getCorrectedCategory()))
                .toList();
    }

    private static CategoryAssignment fromRule(TransactionRule rule) {
        CategorySuggestion suggestion = new CategorySuggestion(rule.getTargetCategory(), RULE_CONFIDENCE,
                "Rule: " + rule.getName(), SuggestionSource.RULE);
        return new CategoryAssignment(suggestion, CategorySource.RULE, List.of(), rule.getId(),
                rule.getTargetBudgetId(), rule.getTargetBudgetCategoryId());
    }

    private static CategoryAssignment fromClassifier(ClassificationResult result) {
        CategorySuggestion primary = new CategorySuggestion(result.category(), result.confidence(),
                result.reasoning(), SuggestionSource.EXTERNAL_CLASSIFIER);
        List<CategorySuggestion> alternatives = result.alternatives() == null ? List.of()
                : result.alternatives().stream()
                .filter(a -> a.category() != null && !a.category().isBlank())
                .map(a -> new CategorySuggestion(a.category(), a.confidence(), null, SuggestionSource.EXTERNAL_CLASSIFIER))
                .toList();
        return new CategoryAssignment(primary, CategorySource.EXTERNAL_CLASSIFIER, alternatives, null, null, null);
    }

    private static ClassificationItem toItem(StagedTransaction txn) {
        return new ClassificationItem(txn.getId(), txn.getDescription(), txn.getMerchantName(),
                txn.getAmount() == null ? null : txn.getAmount().toPlainString(),
                txn.getKind() == null ? null : txn.getKind().name());
    }
}
