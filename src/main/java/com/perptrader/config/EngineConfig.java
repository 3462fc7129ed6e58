package com.perptrader.config;

import com.perptrader.bot.BotRunConfig;
import com.perptrader.ledger.JpaLedgerRepository;
import com.perptrader.simulator.AccountDefaults;
import com.perptrader.simulator.EngineSettings;
import com.perptrader.simulator.SimulationEngine;
import com.perptrader.util.DurationParser;
import java.math.BigDecimal;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Simulation engine, account defaults and bot-run defaults from application.yml.
 *
 * <p>Properties prefix: {@code perptrader.*}
 */
@Configuration
public class EngineConfig {

    @Bean
    public EngineSettings engineSettings(
            @Value("${perptrader.engine.slippage-rate:0.001}") BigDecimal slippageRate,
            @Value("${perptrader.engine.max-leverage:20}") int maxLeverage,
            @Value("${perptrader.engine.tick-size:0.01}") BigDecimal tickSize,
            @Value("${perptrader.engine.quantity-step:0.0001}") BigDecimal quantityStep) {
        return EngineSettings.builder()
                .slippageRate(slippageRate)
                .maxLeverage(maxLeverage)
                .defaultTickSize(tickSize)
                .defaultQuantityStep(quantityStep)
                .build();
    }

    @Bean
    public AccountDefaults accountDefaults(
            @Value("${perptrader.account.starting-equity:10000}") BigDecimal startingEquity,
            @Value("${perptrader.account.default-leverage:1}") int defaultLeverage,
            @Value("${perptrader.account.maker-fee-rate:0.0002}") BigDecimal makerFeeRate,
            @Value("${perptrader.account.taker-fee-rate:0.0005}") BigDecimal takerFeeRate) {
        return AccountDefaults.builder()
                .startingEquity(startingEquity)
                .defaultLeverage(defaultLeverage)
                .makerFeeRate(makerFeeRate)
                .takerFeeRate(takerFeeRate)
                .build();
    }

    @Bean
    public SimulationEngine simulationEngine(
            JpaLedgerRepository ledgerRepository, EngineSettings engineSettings, AccountDefaults accountDefaults) {
        return new SimulationEngine(ledgerRepository, engineSettings, accountDefaults);
    }

    /**
     * Defaults for fields a start request leaves out. Time and loss limits stay null
     * (disabled) unless configured.
     */
    @Bean
    public BotRunConfig botRunDefaults(
            @Value("${perptrader.bot.leverage:2}") int leverage,
            @Value("${perptrader.bot.position-size-percent:10}") BigDecimal positionSizePercent,
            @Value("${perptrader.bot.max-open-positions:3}") int maxOpenPositions,
            @Value("${perptrader.bot.check-interval:60s}") String checkInterval,
            @Value("${perptrader.bot.summary-interval:60s}") String summaryInterval,
            @Value("${perptrader.bot.bar-window:100}") int barWindow,
            @Value("${perptrader.bot.fetch-timeout:30s}") String fetchTimeout,
            @Value("${perptrader.bot.time-limit:}") String timeLimit,
            @Value("${perptrader.bot.max-loss-limit:#{null}}") BigDecimal maxLossLimit) {
        return BotRunConfig.builder()
                .leverage(leverage)
                .positionSizePercent(positionSizePercent)
                .maxOpenPositions(maxOpenPositions)
                .checkInterval(DurationParser.parse(checkInterval))
                .summaryInterval(DurationParser.parse(summaryInterval))
                .barWindow(barWindow)
                .fetchTimeout(DurationParser.parse(fetchTimeout))
                .timeLimit(DurationParser.parseOptional(timeLimit))
                .maxLossLimit(maxLossLimit)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
