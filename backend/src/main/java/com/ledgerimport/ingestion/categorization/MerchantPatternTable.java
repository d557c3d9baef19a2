package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.common.TextNormalizer;
import com.ledgerimport.domain.CategorySource;
import com.ledgerimport.domain.CategorySuggestion;
import com.ledgerimport.domain.MerchantPattern;
import com.ledgerimport.domain.MerchantPatternRepository;
import com.ledgerimport.domain.SuggestionSource;
import com.ledgerimport.ingestion.config.CategorizationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory merchant and keyword table. Seeded with common merchants at the default confidence; learned patterns
 * are loaded from merchant_patterns at startup and replace seeds for the same merchant.
 */
@Component
@Slf4j
public class MerchantPatternTable {

    private static final int MIN_PARTIAL_KEY_LENGTH = 4;
    private static final int MIN_CONFIDENCE = 50;
    private static final int PARTIAL_PENALTY = 20;
    private static final int KEYWORD_PENALTY = 30;

    private final MerchantPatternRepository repository;
    private final int baseConfidence;
    private final Map<String, Entry> patterns = new ConcurrentHashMap<>();
    private final Map<String, String> keywords = new LinkedHashMap<>();

    public MerchantPatternTable(MerchantPatternRepository repository, CategorizationProperties properties) {
        this.repository = repository;
        this.baseConfidence = properties.getDefaultPatternConfidence();
        seed("whole foods", "Groceries");
        seed("trader joe s", "Groceries");
        seed("kroger", "Groceries");
        seed("safeway", "Groceries");
        seed("aldi", "Groceries");
        seed("starbucks", "Dining");
        seed("mcdonald s", "Dining");
        seed("chipotle", "Dining");
        seed("doordash", "Dining");
        seed("uber eats", "Dining");
        seed("amazon", "Shopping");
        seed("target", "Shopping");
        seed("walmart", "Shopping");
        seed("best buy", "Shopping");
        seed("uber", "Transportation");
        seed("lyft", "Transportation");
        seed("shell", "Transportation");
        seed("chevron", "Transportation");
        seed("netflix", "Entertainment");
        seed("spotify", "Entertainment");
        seed("comcast", "Utilities");
        seed("cvs", "Healthcare");

        keyword("Groceries", "grocery", "groceries", "market", "supermarket");
        keyword("Dining", "restaurant", "cafe", "coffee", "pizza", "bistro", "grill");
        keyword("Transportation", "gas", "fuel", "parking", "taxi", "transit", "toll");
        keyword("Healthcare", "pharmacy", "doctor", "medical", "dental", "clinic");
        keyword("Housing", "rent", "mortgage");
        keyword("Utilities", "electric", "water", "internet", "phone", "utility");
        keyword("Income", "payroll", "salary", "dividend");
        keyword("Fees", "fee", "charge");
        keyword("Transfers", "transfer", "xfer");
        keyword("Travel", "airline", "airlines", "hotel", "airbnb");
        keyword("Shopping", "store", "shop", "outlet");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadLearnedPatterns() {
        int loaded = 0;
        for (MerchantPattern p : repository.findAll()) {
            patterns.put(p.getMerchantKey(), new Entry(p.getMerchantKey(), p.getCategory(), p.getConfidence(), p.getOrigin()));
            loaded++;
        }
        log.info("Merchant pattern table ready: {} entries ({} learned)", patterns.size(), loaded);
    }

    /**
     * Exact lookup on the normalised merchant name (the description when there is no merchant).
     */
    public Optional<Entry> directMatch(String merchantName, String description) {
        String key = keyFor(merchantName, description);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(patterns.get(key));
    }

    public static String keyFor(String merchantName, String description) {
        String merchant = TextNormalizer.looseNormalize(merchantName);
        return merchant.isEmpty() ? TextNormalizer.looseNormalize(description) : merchant;
    }

    /**
     * Local categorization chain: direct merchant match, partial merchant match at max(50, base-20),
     * description keyword at max(50, base-30), otherwise Uncategorized at 0.
     */
    public LocalSuggestion suggest(String merchantName, String description) {
        Optional<Entry> direct = directMatch(merchantName, description);
        if (direct.isPresent()) {
            return direct.get().toSuggestion();
        }
        String merchant = TextNormalizer.looseNormalize(merchantName);
        String text = TextNormalizer.looseNormalize(description);
        Optional<Entry> partial = patterns.values().stream()
                .filter(e -> e.merchantKey().length() >= MIN_PARTIAL_KEY_LENGTH)
                .filter(e -> containsPhrase(merchant, e.merchantKey()) || containsPhrase(text, e.merchantKey())
                        || (merchant.length() >= MIN_PARTIAL_KEY_LENGTH && containsPhrase(e.merchantKey(), merchant)))
                .max(Comparator.comparingInt((Entry e) -> e.merchantKey().length()).thenComparingInt(Entry::confidence));
        if (partial.isPresent()) {
            Entry e = partial.get();
            return new LocalSuggestion(new CategorySuggestion(e.category(),
                    Math.max(MIN_CONFIDENCE, e.confidence() - PARTIAL_PENALTY),
                    "Partial merchant match: " + e.merchantKey(), SuggestionSource.PATTERN), e.categorySource());
        }
        Set<String> tokens = new HashSet<>(Arrays.asList(text.split(" ")));
        for (Map.Entry<String, String> kw : keywords.entrySet()) {
            if (tokens.contains(kw.getKey())) {
                return new LocalSuggestion(new CategorySuggestion(kw.getValue(),
                        Math.max(MIN_CONFIDENCE, baseConfidence - KEYWORD_PENALTY),
                        "Description keyword: " + kw.getKey(), SuggestionSource.KEYWORD), CategorySource.RULE);
            }
        }
        return new LocalSuggestion(CategorySuggestion.uncategorized(), CategorySource.RULE);
    }

    /**
     * Store a learned pattern; visible to the next lookup immediately.
     */
    public Entry learn(String merchantKey, String category, int confidence, int correctionCount, double agreementRatio) {
        MerchantPattern pattern = repository.findByMerchantKey(merchantKey).orElseGet(MerchantPattern::new);
        pattern.setMerchantKey(merchantKey);
        pattern.setCategory(category);
        pattern.setConfidence(confidence);
        pattern.setOrigin(MerchantPattern.Origin.LEARNED);
        pattern.setCorrectionCount(correctionCount);
        pattern.setAgreementRatio(agreementRatio);
        pattern.setUpdatedAt(Instant.now());
        repository.save(pattern);
        Entry entry = new Entry(merchantKey, category, confidence, MerchantPattern.Origin.LEARNED);
        patterns.put(merchantKey, entry);
        log.info("Learned merchant pattern {} -> {} ({}% after {} corrections)", merchantKey, category, confidence, correctionCount);
        return entry;
    }

    int size() {
        return patterns.size();
    }

    private void seed(String merchantKey, String category) {
        patterns.put(merchantKey, new Entry(merchantKey, category, baseConfidence, MerchantPattern.Origin.DEFAULT));
    }

    private void keyword(String category, String... words) {
        for (String w : words) {
            keywords.put(w, category);
        }
    }

    private static boolean containsPhrase(String haystack, String phrase) {
        if (haystack.isEmpty() || phrase.isEmpty()) {
            return false;
        }
        return (" " + haystack + " ").contains(" " + phrase + " ");
    }

    public record Entry(String merchantKey, String category, int confidence, MerchantPattern.Origin origin) {

        CategorySource categorySource() {
            return origin == MerchantPattern.Origin.LEARNED ? CategorySource.LEARNED : CategorySource.RULE;
        }

        LocalSuggestion toSuggestion() {
            return new LocalSuggestion(new CategorySuggestion(category, confidence,
                    "Merchant pattern: " + merchantKey, SuggestionSource.PATTERN), categorySource());
        }
    }

    public record LocalSuggestion(CategorySuggestion suggestion, CategorySource source) {
    }
}
