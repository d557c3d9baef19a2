package com.ledgerimport.domain;

/**
 * TRANSFER: resource moved between agents (debit, credit, transfer). RETIRE: resource consumed (fees).
 */
public enum EconomicEventType {
    TRANSFER,
    RETIRE
}
