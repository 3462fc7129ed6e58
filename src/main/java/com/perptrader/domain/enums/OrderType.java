package com.perptrader.domain.enums;

/**
 * Why an order was generated. Paper orders are always filled synchronously at the
 * derived fill price, so the type records intent rather than matching behavior.
 */
public enum OrderType {
    MARKET_OPEN,
    MARKET_CLOSE,
    STOP_LOSS,
    TAKE_PROFIT,
    LIQUIDATION
}
