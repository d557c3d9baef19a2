package com.ledgerimport.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class VariancePoint {

    private Instant at;
    private BigDecimal totalPlanned;
    private BigDecimal totalActual;
    private BigDecimal variance;
    private BudgetHealthStatus healthStatus;
}
