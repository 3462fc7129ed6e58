package com.perptrader.domain.enums;

public enum DecisionType {
    OPEN,
    CLOSE,
    HOLD
}
