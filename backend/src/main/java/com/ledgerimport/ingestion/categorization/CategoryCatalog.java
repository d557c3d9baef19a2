package com.ledgerimport.ingestion.categorization;

import com.ledgerimport.config.CaffeineConfig;
import com.ledgerimport.domain.Budget;
import com.ledgerimport.domain.BudgetCategory;
import com.ledgerimport.domain.BudgetRepository;
import com.ledgerimport.ingestion.config.ClassifierProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Category names offered to the classifier: configured defaults plus the owner's budget category names.
 */
@Component
@RequiredArgsConstructor
public class CategoryCatalog {

    private final BudgetRepository budgetRepository;
    private final ClassifierProperties classifierProperties;

    @Cacheable(cacheNames = CaffeineConfig.BUDGET_CATEGORY_CACHE, key = "#ownerId")
    public List<String> categoriesFor(String ownerId) {
        Set<String> names = new LinkedHashSet<>(classifierProperties.getDefaultCategories());
        for (Budget budget : budgetRepository.findByOwnerId(ownerId)) {
            budget.getCategories().stream()
                    .map(BudgetCategory::getName)
                    .filter(n -> n != null && !n.isBlank())
                    .forEach(names::add);
        }
        return List.copyOf(names);
    }
}
