package com.perptrader.simulator;

import java.math.BigDecimal;

/**
 * Exchange fees on fills. Paper fills are market fills, so the account's taker rate is
 * charged on the filled notional of every entry and exit.
 */
public class FeeCalculator {

    public BigDecimal takerFee(BigDecimal fillPrice, BigDecimal size, BigDecimal takerFeeRate) {
        return LedgerMath.money(fillPrice.multiply(size).multiply(takerFeeRate));
    }
}
