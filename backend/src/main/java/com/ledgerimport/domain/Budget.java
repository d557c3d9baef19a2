package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Budget owned by the budgeting service. Category actuals are only ever changed with $inc so sequential
 * reconciliations accumulate.
 */
@Document(collection = "budgets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Budget {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String ownerId;
    private String name;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private List<BudgetCategory> categories = new ArrayList<>();
    private BudgetHealthStatus healthStatus = BudgetHealthStatus.HEALTHY;
    private Instant lastReconciledAt;
    /** Most recent variance points, oldest first. */
    private List<VariancePoint> varianceTrend = new ArrayList<>();

    public Optional<BudgetCategory> findCategory(String categoryId) {
        return categories.stream().filter(c -> c.getCategoryId().equals(categoryId)).findFirst();
    }

    public BigDecimal totalPlanned() {
        return categories.stream().map(BudgetCategory::getPlanned).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalActual() {
        return categories.stream().map(BudgetCategory::getActual).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
