package com.perptrader.strategy.impl;

import com.perptrader.strategy.base.BaseStrategyConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the support/resistance breakout strategy.
 *
 * <p>Levels are local extremes: a bar's high (low) that is the highest (lowest) within
 * {@code extremaWindow} bars on either side, searched over the last {@code lookback} bars.
 * An entry needs three confirmations:
 * <ul>
 *   <li>close beyond the nearest level by at least {@code breakoutThresholdPercent}</li>
 *   <li>volume at least {@code minVolumeRatio} times its {@code volumePeriod} average</li>
 *   <li>RSI not already stretched in the breakout direction</li>
 * </ul>
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class BreakoutConfig extends BaseStrategyConfig {

    @Min(12)
    @Max(500)
    @Builder.Default
    private int lookback = 30;

    @Min(1)
    @Max(20)
    @Builder.Default
    private int extremaWindow = 5;

    /** Bars before the current one in which price must have been inside the range. */
    @Min(1)
    @Max(10)
    @Builder.Default
    private int confirmationBars = 3;

    @Positive
    @Builder.Default
    private double breakoutThresholdPercent = 0.5;

    @Min(2)
    @Builder.Default
    private int volumePeriod = 20;

    @DecimalMin("0.0")
    @Builder.Default
    private double minVolumeRatio = 1.5;

    @Min(2)
    @Builder.Default
    private int rsiPeriod = 14;

    /** No long entries with RSI above this. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    @Builder.Default
    private double rsiLongCeiling = 65;

    /** No short entries with RSI below this. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    @Builder.Default
    private double rsiShortFloor = 35;

    @Min(2)
    @Builder.Default
    private int atrPeriod = 14;

    @Positive
    @Builder.Default
    private double atrStopMultiplier = 2.0;

    /** Stop is never placed closer than this percent from the entry. */
    @DecimalMin("0.0")
    @Builder.Default
    private double minStopPercent = 2.0;

    @Positive
    @Builder.Default
    private double riskRewardRatio = 2.0;

    /** Trailing-stop distance in percent; null disables trailing. */
    @Positive
    @Builder.Default
    private Double trailingStopPercent = 1.5;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    @Builder.Default
    private double exitRsiOverbought = 70;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    @Builder.Default
    private double exitRsiOversold = 30;

    /** Momentum exits only fire once the move is at least this far in profit (percent). */
    @DecimalMin("0.0")
    @Builder.Default
    private double exitMinProfitPercent = 2.0;

    /** ATR below this percent of price counts as a contracted range and closes the position. */
    @DecimalMin("0.0")
    @Builder.Default
    private double minAtrPercent = 0.2;

    @Override
    public void validate() {
        super.validate();
        require(rsiShortFloor < rsiLongCeiling, "rsiShortFloor must be below rsiLongCeiling");
        require(exitRsiOversold < exitRsiOverbought, "exitRsiOversold must be below exitRsiOverbought");
        require(2 * extremaWindow < lookback, "lookback must exceed twice the extremaWindow");
    }
}
