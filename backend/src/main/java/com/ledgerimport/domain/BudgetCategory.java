package com.ledgerimport.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Embedded in {@link Budget}.
 */
@NoArgsConstructor
@Getter
@Setter
public class BudgetCategory {

    private String categoryId;
    private String name;
    private BigDecimal planned = BigDecimal.ZERO;
    private BigDecimal actual = BigDecimal.ZERO;
    private List<String> linkedEventIds = new ArrayList<>();

    public BudgetCategory(String categoryId, String name, BigDecimal planned) {
        this.categoryId = categoryId;
        this.name = name;
        this.planned = planned;
    }
}
