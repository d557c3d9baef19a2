package com.ledgerimport.domain;

/**
 * Application event: enough consistent corrections for a merchant that an auto-categorization rule may be created.
 * Creating the rule is left to the consumer.
 */
public record AutoRuleEligibleEvent(String ownerId, String merchantKey, String category, int correctionCount,
                                    double agreementRatio) {
}
