package com.perptrader.simulator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scale and rounding conventions shared by everything that computes ledger amounts.
 */
public final class LedgerMath {

    /** Scale of stored money amounts. */
    public static final int MONEY_SCALE = 8;

    /** Scale used when presenting amounts. */
    public static final int DISPLAY_SCALE = 2;

    public static final BigDecimal HUNDRED = new BigDecimal("100");

    private LedgerMath() {}

    public static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal display(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
    }

    /** {@code part / whole * 100} at scale 4, or zero when {@code whole} is zero. */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, 4, RoundingMode.HALF_UP);
    }
}
