package com.perptrader.backtest;

import com.perptrader.domain.enums.CloseReason;
import com.perptrader.domain.model.Account;
import com.perptrader.domain.model.Bar;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.ledger.InMemoryLedgerRepository;
import com.perptrader.reporting.PerformanceCalculator;
import com.perptrader.simulator.CloseResult;
import com.perptrader.simulator.LedgerMath;
import com.perptrader.simulator.OpenRequest;
import com.perptrader.simulator.OpenResult;
import com.perptrader.simulator.RiskTrigger;
import com.perptrader.simulator.SimulationEngine;
import com.perptrader.simulator.Sizing;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.MarketSnapshot;
import com.perptrader.strategy.base.TradingStrategy;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Replays a time-ordered bar series through a strategy and a private SimulationEngine.
 *
 * <p>The first {@code max(minimumBarsRequired, warmupBars)} bars only build history. For
 * every later bar, in order:
 * <ol>
 *   <li>trailing stop follows the bar's open</li>
 *   <li>stop-loss, take-profit and liquidation are checked against the bar's range and
 *       filled at the trigger price (stop first when the bar spans both)</li>
 *   <li>open positions are marked at the close</li>
 *   <li>the strategy decides on the last {@code max(barWindow, minimumBarsRequired)} bars;
 *       fills happen at the close</li>
 * </ol>
 * A position still open after the last bar is closed at its close with END_OF_DATA.
 *
 * <p>Every timestamp comes from the series, so cooldowns and holding limits behave exactly
 * as they would have live. Single-threaded and deterministic: the same bars, strategy
 * config and settings always produce the same trades.
 */
@Component
public class BacktestReplayer {

    private static final Logger log = LoggerFactory.getLogger(BacktestReplayer.class);

    private final PerformanceCalculator performanceCalculator;

    public BacktestReplayer(PerformanceCalculator performanceCalculator) {
        this.performanceCalculator = performanceCalculator;
    }

    public BacktestResult run(TradingStrategy strategy, List<Bar> bars, BacktestSettings settings) {
        SimulationEngine engine = new SimulationEngine(
                new InMemoryLedgerRepository(), settings.getEngineSettings(), settings.getAccountDefaults());
        String accountName = settings.getAccountName();
        String symbol = settings.getSymbol();
        int warmup = Math.max(1, Math.max(strategy.getMinimumBarsRequired(), settings.getWarmupBars()));
        int window = Math.max(settings.getBarWindow(), strategy.getMinimumBarsRequired());

        BigDecimal startingEquity = settings.getStartingEquity();
        if (!bars.isEmpty()) {
            engine.getOrCreateAccount(accountName, startingEquity, bars.get(0).getTimestamp());
        }

        log.info(
                "Backtest {} on {}: {} bars, warm-up {}, window {}",
                strategy.getName(), symbol, bars.size(), warmup, window);

        int rejectedOpens = 0;
        for (int i = warmup - 1; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            Optional<Position> open = engine.getOpenPosition(accountName, symbol);

            if (open.isPresent()) {
                Position position = open.get();
                engine.updateTrailingStop(position, bar.getOpen());
                Optional<RiskTrigger> trigger = engine.checkRiskTriggers(position, bar);
                if (trigger.isPresent()) {
                    close(engine, strategy, position, trigger.get().getExitPrice(), trigger.get().getReason(), bar);
                } else {
                    engine.markToMarket(position, bar.getClose());
                }
            }

            MarketSnapshot snapshot = MarketSnapshot.builder()
                    .symbol(symbol)
                    .bars(bars.subList(Math.max(0, i + 1 - window), i + 1))
                    .lastPrice(bar.getClose())
                    .timestamp(bar.getTimestamp())
                    .fundingRate(fundingAt(settings, bar))
                    .build();
            Optional<Position> current = engine.getOpenPosition(accountName, symbol);
            Decision decision = strategy.evaluate(snapshot, current);

            if (decision.isOpen() && current.isEmpty()) {
                OpenResult result = engine.open(OpenRequest.builder()
                        .accountName(accountName)
                        .symbol(symbol)
                        .side(decision.getSide())
                        .sizing(Sizing.balancePercent(settings.getPositionSizePercent()))
                        .leverage(settings.getLeverage())
                        .referencePrice(bar.getClose())
                        .stopLoss(decision.getStopLoss())
                        .takeProfit(decision.getTakeProfit())
                        .trailingStopPercent(decision.getTrailingStopPercent())
                        .strategyId(strategy.getId())
                        .timestamp(bar.getTimestamp())
                        .build());
                if (result.isRejected()) {
                    rejectedOpens++;
                }
            } else if (decision.isClose() && current.isPresent()) {
                close(engine, strategy, current.get(), bar.getClose(), CloseReason.STRATEGY_SIGNAL, bar);
            }
        }

        if (!bars.isEmpty()) {
            Bar last = bars.get(bars.size() - 1);
            engine.getOpenPosition(accountName, symbol)
                    .ifPresent(p -> close(engine, strategy, p, last.getClose(), CloseReason.END_OF_DATA, last));
        }

        List<Trade> trades = engine.getTrades(accountName);
        BigDecimal finalBalance = engine.findAccount(accountName)
                .map(Account::getBalance)
                .orElse(startingEquity);
        int processed = Math.max(0, bars.size() - (warmup - 1));

        BacktestResult result = BacktestResult.builder()
                .strategyId(strategy.getId())
                .strategyName(strategy.getName())
                .symbol(symbol)
                .barsProcessed(processed)
                .warmupBars(warmup)
                .startTime(bars.isEmpty() ? null : bars.get(0).getTimestamp())
                .endTime(bars.isEmpty() ? null : bars.get(bars.size() - 1).getTimestamp())
                .startingEquity(LedgerMath.display(startingEquity))
                .finalBalance(LedgerMath.display(finalBalance))
                .rejectedOpens(rejectedOpens)
                .report(performanceCalculator.calculate(trades, startingEquity))
                .equityCurve(performanceCalculator.equityCurve(
                        trades, startingEquity, bars.isEmpty() ? null : bars.get(0).getTimestamp()))
                .trades(trades)
                .build();

        log.info(
                "Backtest {} on {} finished: {} trades, final balance {}, net {}",
                strategy.getName(),
                symbol,
                trades.size(),
                result.getFinalBalance(),
                result.getReport().getTotalNetPnl());
        return result;
    }

    private void close(
            SimulationEngine engine,
            TradingStrategy strategy,
            Position position,
            BigDecimal price,
            CloseReason reason,
            Bar bar) {
        CloseResult result = engine.close(position, price, reason, bar.getTimestamp());
        if (!result.isRejected()) {
            strategy.onPositionClosed(result.getTrade());
        }
    }

    private static BigDecimal fundingAt(BacktestSettings settings, Bar bar) {
        Map.Entry<Instant, BigDecimal> entry = settings.getFundingRates().floorEntry(bar.getTimestamp());
        return entry == null ? null : entry.getValue();
    }
}
