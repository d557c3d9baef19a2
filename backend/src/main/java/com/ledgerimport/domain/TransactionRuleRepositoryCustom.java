package com.ledgerimport.domain;

/**
 * Rule accuracy counters ($inc, no read-modify-write).
 */
public interface TransactionRuleRepositoryCustom {

    void incrementAppliedCount(String ruleId);

    void incrementCorrectCount(String ruleId);
}
