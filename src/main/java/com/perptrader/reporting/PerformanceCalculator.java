package com.perptrader.reporting;

import com.perptrader.domain.model.Trade;
import com.perptrader.simulator.LedgerMath;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes performance statistics as pure functions of a closed-trade list.
 *
 * <p>Trades are ordered by close time before anything path-dependent (drawdown, streaks,
 * equity curve) is computed, so the same list always yields the same report regardless of
 * the order it was supplied in.
 */
@Component
public class PerformanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCalculator.class);

    static final BigDecimal PROFIT_FACTOR_CAP = new BigDecimal("999.99");

    /**
     * @param startingEquity equity before the first trade; the drawdown percent is measured
     *     against the running peak of {@code startingEquity + cumulative net PnL}
     */
    public PerformanceReport calculate(List<Trade> trades, BigDecimal startingEquity) {
        if (trades.isEmpty()) {
            return PerformanceReport.empty();
        }
        List<Trade> sorted = sortByClose(trades);

        int totalTrades = sorted.size();
        List<BigDecimal> wins = sorted.stream().filter(Trade::isWin).map(Trade::getNetPnl).toList();
        List<BigDecimal> losses = sorted.stream()
                .filter(t -> !t.isWin())
                .map(Trade::getNetPnl)
                .toList();

        BigDecimal winRate = BigDecimal.valueOf(wins.size())
                .divide(BigDecimal.valueOf(totalTrades), 4, RoundingMode.HALF_UP)
                .multiply(LedgerMath.HUNDRED);

        BigDecimal totalNetPnl = sum(sorted.stream().map(Trade::getNetPnl).toList());
        BigDecimal grossProfit = sum(wins);
        BigDecimal grossLoss = sum(losses).abs();

        // Profit factor = gross profit / gross loss
        BigDecimal profitFactor;
        boolean unbounded = false;
        if (grossLoss.signum() > 0) {
            profitFactor = grossProfit.divide(grossLoss, 2, RoundingMode.HALF_UP);
        } else if (grossProfit.signum() > 0) {
            profitFactor = PROFIT_FACTOR_CAP;
            unbounded = true;
        } else {
            profitFactor = BigDecimal.ZERO;
        }

        Drawdown drawdown = calculateMaxDrawdown(sorted, startingEquity);
        Streaks streaks = calculateStreaks(sorted);

        long averageHoldingSeconds = (long) sorted.stream()
                .mapToLong(t -> t.getHoldingDuration().getSeconds())
                .average()
                .orElse(0);

        PerformanceReport report = PerformanceReport.builder()
                .totalTrades(totalTrades)
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate(winRate.setScale(2, RoundingMode.HALF_UP))
                .totalNetPnl(LedgerMath.display(totalNetPnl))
                .grossProfit(LedgerMath.display(grossProfit))
                .grossLoss(LedgerMath.display(grossLoss))
                .profitFactor(profitFactor)
                .profitFactorUnbounded(unbounded)
                .averageWin(average(wins))
                .averageLoss(average(losses))
                .largestWin(LedgerMath.display(wins.stream().max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO)))
                .largestLoss(LedgerMath.display(losses.stream().min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO)))
                .maxDrawdown(LedgerMath.display(drawdown.amount()))
                .maxDrawdownPercent(drawdown.percent().setScale(2, RoundingMode.HALF_UP))
                .sharpeRatio(calculateSharpeRatio(sorted))
                .maxConsecutiveWins(streaks.wins())
                .maxConsecutiveLosses(streaks.losses())
                .averageHoldingSeconds(averageHoldingSeconds)
                .totalFees(LedgerMath.display(sum(sorted.stream().map(Trade::getTotalFees).toList())))
                .build();

        log.debug(
                "Performance over {} trades: {}% win rate, PF={}, maxDD={}",
                totalTrades, report.getWinRate(), profitFactor, report.getMaxDrawdown());
        return report;
    }

    /** Starting point followed by realized equity after each trade, in close order. */
    public List<EquityPoint> equityCurve(List<Trade> trades, BigDecimal startingEquity, Instant start) {
        List<EquityPoint> curve = new ArrayList<>();
        curve.add(new EquityPoint(start, startingEquity));
        BigDecimal equity = startingEquity;
        for (Trade trade : sortByClose(trades)) {
            equity = equity.add(trade.getNetPnl());
            curve.add(new EquityPoint(trade.getClosedAt(), equity));
        }
        return curve;
    }

    /** Max drawdown over the cumulative net PnL path, as an amount and as percent of the peak. */
    Drawdown calculateMaxDrawdown(List<Trade> sorted, BigDecimal startingEquity) {
        BigDecimal peak = startingEquity;
        BigDecimal equity = startingEquity;
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal maxDrawdownPercent = BigDecimal.ZERO;

        for (Trade trade : sorted) {
            equity = equity.add(trade.getNetPnl());
            if (equity.compareTo(peak) > 0) {
                peak = equity;
            }
            BigDecimal drawdown = peak.subtract(equity);
            if (drawdown.compareTo(maxDrawdown) > 0) {
                maxDrawdown = drawdown;
            }
            if (peak.signum() > 0) {
                BigDecimal percent = LedgerMath.percentOf(drawdown, peak);
                if (percent.compareTo(maxDrawdownPercent) > 0) {
                    maxDrawdownPercent = percent;
                }
            }
        }
        return new Drawdown(maxDrawdown, maxDrawdownPercent);
    }

    /**
     * Simplified Sharpe ratio: mean / standard deviation of per-trade net PnL.
     * Not annualized since trades are not time-uniform.
     */
    BigDecimal calculateSharpeRatio(List<Trade> trades) {
        if (trades.size() < 2) {
            return BigDecimal.ZERO;
        }
        double mean = trades.stream().mapToDouble(t -> t.getNetPnl().doubleValue()).average().orElse(0);
        double variance = trades.stream()
                .mapToDouble(t -> Math.pow(t.getNetPnl().doubleValue() - mean, 2))
                .average()
                .orElse(0);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(mean / stdDev).setScale(2, RoundingMode.HALF_UP);
    }

    private Streaks calculateStreaks(List<Trade> sorted) {
        int maxWins = 0;
        int maxLosses = 0;
        int wins = 0;
        int losses = 0;
        for (Trade trade : sorted) {
            if (trade.isWin()) {
                wins++;
                losses = 0;
            } else {
                losses++;
                wins = 0;
            }
            maxWins = Math.max(maxWins, wins);
            maxLosses = Math.max(maxLosses, losses);
        }
        return new Streaks(maxWins, maxLosses);
    }

    private static List<Trade> sortByClose(List<Trade> trades) {
        return trades.stream().sorted(Comparator.comparing(Trade::getClosedAt)).toList();
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return sum(values).divide(BigDecimal.valueOf(values.size()), LedgerMath.DISPLAY_SCALE, RoundingMode.HALF_UP);
    }

    record Drawdown(BigDecimal amount, BigDecimal percent) {}

    private record Streaks(int wins, int losses) {}
}
