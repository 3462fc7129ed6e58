package com.perptrader.marketdata;

import java.math.BigDecimal;
import java.util.Optional;

/** Periodic funding rate, in percent per funding interval. Empty when unknown for the symbol. */
public interface FundingRateSource {

    Optional<BigDecimal> fetchFundingRate(String symbol);
}
