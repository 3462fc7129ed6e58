package com.perptrader.simulator;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Values used when an account is created on first use.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccountDefaults {

    @Builder.Default
    private BigDecimal startingEquity = new BigDecimal("10000");

    @Builder.Default
    private int defaultLeverage = 1;

    @Builder.Default
    private BigDecimal makerFeeRate = new BigDecimal("0.0002");

    @Builder.Default
    private BigDecimal takerFeeRate = new BigDecimal("0.0005");
}
