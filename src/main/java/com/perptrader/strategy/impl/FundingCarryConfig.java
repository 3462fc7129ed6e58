package com.perptrader.strategy.impl;

import com.perptrader.strategy.base.BaseStrategyConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the funding-rate carry strategy. Rates are in percent per funding
 * interval (0.01 means 0.01% every {@code fundingIntervalHours}).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class FundingCarryConfig extends BaseStrategyConfig {

    @Positive
    @Builder.Default
    private double minFundingRatePercent = 0.01;

    /** Rate at which confidence saturates at 10. */
    @Positive
    @Builder.Default
    private double targetFundingRatePercent = 0.05;

    /** Close once the favorable rate decays below this fraction of the minimum. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private double exitFraction = 0.5;

    @Min(1)
    @Builder.Default
    private int fundingIntervalHours = 8;

    /** After this many hours a rate below the minimum (not just below the exit fraction) closes. */
    @Min(0)
    @Builder.Default
    private int minHoldingHours = 24;

    @Positive
    @Builder.Default
    private double maxPriceDeviationPercent = 10.0;

    @Override
    public void validate() {
        super.validate();
        require(
                minFundingRatePercent < targetFundingRatePercent,
                "minFundingRatePercent must be below targetFundingRatePercent");
    }
}
