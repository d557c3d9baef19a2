package com.ledgerimport.domain;

/**
 * Who assigned the category on a staged transaction. MANUAL is never overwritten by machine categorization.
 */
public enum CategorySource {
    RULE,
    LEARNED,
    EXTERNAL_CLASSIFIER,
    MANUAL
}
