package com.perptrader.domain.enums;

import java.math.BigDecimal;

/**
 * Direction of a perpetual position. LONG profits when price rises, SHORT when it falls.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies (exit - entry) into signed PnL. */
    public BigDecimal sign() {
        return this == LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
    }

    /** Order side that opens this exposure. */
    public OrderSide openingSide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    /** Order side that closes this exposure. */
    public OrderSide closingSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}
