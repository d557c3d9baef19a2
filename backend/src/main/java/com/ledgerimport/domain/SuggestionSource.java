package com.ledgerimport.domain;

public enum SuggestionSource {
    RULE,
    PATTERN,
    KEYWORD,
    EXTERNAL_CLASSIFIER,
    HISTORICAL,
    NONE
}
