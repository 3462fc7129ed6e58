package com.perptrader.strategy.impl;

import com.perptrader.strategy.base.BaseStrategyConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the oscillator mean-reversion strategy.
 *
 * <p>Exits are budgeted in quote currency ({@code profitTarget}, {@code lossLimit}) rather
 * than percent, and every position is bounded in time: when {@code maxHoldingSeconds} is
 * not set the strategy applies {@link MeanReversionStrategy#DEFAULT_MAX_HOLDING_SECONDS}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MeanReversionConfig extends BaseStrategyConfig {

    @Min(2)
    @Builder.Default
    private int rsiPeriod = 14;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    @Builder.Default
    private double oversold = 30;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    @Builder.Default
    private double overbought = 70;

    /** Bars over which the directional impulse is measured. */
    @Min(1)
    @Builder.Default
    private int impulseLookback = 4;

    @Positive
    @Builder.Default
    private double impulseThresholdPercent = 0.8;

    @Min(2)
    @Builder.Default
    private int atrPeriod = 14;

    @Positive
    @Builder.Default
    private double atrStopMultiplier = 2.0;

    @Positive
    @Builder.Default
    private double atrTargetMultiplier = 3.0;

    /** Close once unrealized PnL reaches this amount. */
    @NotNull
    @Positive
    @Builder.Default
    private BigDecimal profitTarget = new BigDecimal("50");

    /** Close once unrealized loss reaches this amount. */
    @NotNull
    @Positive
    @Builder.Default
    private BigDecimal lossLimit = new BigDecimal("25");

    @Override
    public void validate() {
        super.validate();
        require(oversold < overbought, "oversold must be below overbought");
    }
}
