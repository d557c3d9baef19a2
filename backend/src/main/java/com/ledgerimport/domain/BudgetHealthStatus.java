package com.ledgerimport.domain;

public enum BudgetHealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
