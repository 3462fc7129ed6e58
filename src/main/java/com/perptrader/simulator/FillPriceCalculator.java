package com.perptrader.simulator;

import com.perptrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derives fill prices from reference prices.
 *
 * <p>Slippage always works against the trader:
 * <ul>
 *   <li><b>LONG entry / SHORT exit</b> (buying): {@code reference * (1 + slippage)}</li>
 *   <li><b>LONG exit / SHORT entry</b> (selling): {@code reference * (1 - slippage)}</li>
 * </ul>
 * The slipped price is then rounded to the instrument tick (HALF_UP) so that PnL is always
 * computed from prices the venue could actually print.
 */
public class FillPriceCalculator {

    private final BigDecimal slippageRate;

    public FillPriceCalculator(BigDecimal slippageRate) {
        this.slippageRate = slippageRate;
    }

    public BigDecimal entryFill(PositionSide side, BigDecimal referencePrice, BigDecimal tickSize) {
        return roundToTick(slip(referencePrice, side == PositionSide.LONG), tickSize);
    }

    public BigDecimal exitFill(PositionSide side, BigDecimal referencePrice, BigDecimal tickSize) {
        return roundToTick(slip(referencePrice, side == PositionSide.SHORT), tickSize);
    }

    private BigDecimal slip(BigDecimal referencePrice, boolean buying) {
        BigDecimal factor = buying ? BigDecimal.ONE.add(slippageRate) : BigDecimal.ONE.subtract(slippageRate);
        return referencePrice.multiply(factor);
    }

    public static BigDecimal roundToTick(BigDecimal price, BigDecimal tickSize) {
        if (tickSize == null || tickSize.signum() <= 0) {
            return price;
        }
        BigDecimal ticks = price.divide(tickSize, 0, RoundingMode.HALF_UP);
        return ticks.multiply(tickSize).setScale(Math.max(tickSize.scale(), 0), RoundingMode.HALF_UP);
    }

    /** Rounds a quantity down to a whole number of steps so sizing never exceeds the request. */
    public static BigDecimal roundDownToStep(BigDecimal quantity, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return quantity;
        }
        BigDecimal steps = quantity.divide(step, 0, RoundingMode.DOWN);
        return steps.multiply(step).setScale(Math.max(step.scale(), 0), RoundingMode.DOWN);
    }
}
