package com.perptrader.domain.enums;

public enum PositionStatus {
    OPEN,
    CLOSED
}
