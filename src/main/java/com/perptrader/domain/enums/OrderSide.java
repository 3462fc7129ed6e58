package com.perptrader.domain.enums;

public enum OrderSide {
    BUY,
    SELL
}
