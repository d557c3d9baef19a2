package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.common.TextNormalizer;
import com.ledgerimport.domain.StagedTransaction;
import com.ledgerimport.domain.TransactionRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates authored {@link TransactionRule}s against a staged transaction. Rules are expected in priority order;
 * the first match wins.
 */
@Component
@Slf4j
public class RuleMatcher {

    private final Map<String, Optional<Pattern>> compiled = new ConcurrentHashMap<>();

    public Optional<TransactionRule> firstMatch(List<TransactionRule> rulesByPriority, StagedTransaction txn) {
        for (TransactionRule rule : rulesByPriority) {
            if (rule.isEnabled() && matches(rule, txn)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    boolean matches(TransactionRule rule, StagedTransaction txn) {
        if (rule.getMatchType() == null || rule.getMatchValue() == null) {
            return false;
        }
        return switch (rule.getMatchType()) {
            case MERCHANT -> !TextNormalizer.isBlank(txn.getMerchantName())
                    && TextNormalizer.looseNormalize(txn.getMerchantName()).equals(TextNormalizer.looseNormalize(rule.getMatchValue()));
            case AMOUNT_RANGE -> inRange(txn.getAmount(), rule.getMatchValue(), rule.getMatchMaxValue());
            case EXACT -> fieldValue(rule, txn).equalsIgnoreCase(rule.getMatchValue().strip());
            case CONTAINS -> lower(fieldValue(rule, txn)).contains(lower(rule.getMatchValue().strip()));
            case STARTS_WITH -> lower(fieldValue(rule, txn)).startsWith(lower(rule.getMatchValue().strip()));
            case REGEX -> pattern(rule).map(p -> p.matcher(fieldValue(rule, txn)).find()).orElse(false);
        };
    }

    private static String fieldValue(TransactionRule rule, StagedTransaction txn) {
        TransactionRule.MatchField field = rule.getMatchField() == null
                ? TransactionRule.MatchField.DESCRIPTION : rule.getMatchField();
        String value = switch (field) {
            case DESCRIPTION -> txn.getDescription();
            case MERCHANT -> txn.getMerchantName();
            case ACCOUNT -> txn.getExternalAccountId();
            case AMOUNT -> txn.getAmount() == null ? null : txn.getAmount().toPlainString();
        };
        return value == null ? "" : value.strip();
    }

    private static boolean inRange(BigDecimal amount, String min, BigDecimal max) {
        if (amount == null) {
            return false;
        }
        try {
            BigDecimal lower = new BigDecimal(min.strip());
            return amount.compareTo(lower) >= 0 && (max == null || amount.compareTo(max) <= 0);
        } catch (NumberFormatException e) {
            log.warn("AMOUNT_RANGE rule has non-numeric lower bound '{}'", min);
            return false;
        }
    }

    private Optional<Pattern> pattern(TransactionRule rule) {
        return compiled.computeIfAbsent(rule.getMatchValue(), value -> {
            try {
                return Optional.of(Pattern.compile(value, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("Rule {} has invalid regex, ignoring: {}", rule.getId(), e.getDescription());
                return Optional.empty();
            }
        });
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
