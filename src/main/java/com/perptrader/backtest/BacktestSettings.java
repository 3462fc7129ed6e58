package com.perptrader.backtest;

import com.perptrader.simulator.AccountDefaults;
import com.perptrader.simulator.EngineSettings;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one backtest replay.
 *
 * <p>Each replay runs on a fresh in-memory ledger, so {@code accountName} only labels the
 * trades. {@code fundingRates} (percent per interval, keyed by the time they take effect)
 * feeds carry strategies; empty means no funding data.
 */
@Value
@Builder
public class BacktestSettings {

    String symbol;

    @Builder.Default
    String accountName = "backtest";

    @Builder.Default
    BigDecimal startingEquity = new BigDecimal("10000");

    @Builder.Default
    int leverage = 2;

    /** Share of the free balance committed as margin per position. */
    @Builder.Default
    BigDecimal positionSizePercent = new BigDecimal("10");

    @Builder.Default
    int warmupBars = 50;

    @Builder.Default
    int barWindow = 100;

    @Builder.Default
    EngineSettings engineSettings = EngineSettings.builder().build();

    @Builder.Default
    AccountDefaults accountDefaults = AccountDefaults.builder().build();

    @Builder.Default
    NavigableMap<Instant, BigDecimal> fundingRates = new TreeMap<>();
}
