package com.perptrader.simulator;

import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * How large a new position should be.
 * <ul>
 *   <li><b>QUANTITY:</b> contracts in base units</li>
 *   <li><b>NOTIONAL:</b> quote-currency value at the reference price</li>
 *   <li><b>BALANCE_PERCENT:</b> percent of free balance committed as margin; the notional
 *       is that margin times leverage</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Sizing {

    public enum Kind {
        QUANTITY,
        NOTIONAL,
        BALANCE_PERCENT
    }

    Kind kind;
    BigDecimal amount;

    public static Sizing quantity(BigDecimal quantity) {
        return new Sizing(Kind.QUANTITY, quantity);
    }

    public static Sizing notional(BigDecimal notional) {
        return new Sizing(Kind.NOTIONAL, notional);
    }

    public static Sizing balancePercent(BigDecimal percent) {
        return new Sizing(Kind.BALANCE_PERCENT, percent);
    }
}
