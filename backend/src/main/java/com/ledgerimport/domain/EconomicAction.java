package com.ledgerimport.domain;

public enum EconomicAction {
    TRANSFER,
    CONSUME
}
