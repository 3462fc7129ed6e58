package com.perptrader.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Statistics over a list of closed trades.
 *
 * <p>Key metrics:
 * <ul>
 *   <li>Win rate and profit factor for profitability assessment</li>
 *   <li>Max drawdown (amount and percent of peak equity) and Sharpe ratio for risk</li>
 *   <li>Streaks and average holding time for operational insight</li>
 * </ul>
 *
 * <p>With no losing trades and a positive gross profit, {@code profitFactor} is capped at
 * 999.99 and {@code profitFactorUnbounded} is true.
 */
@Data
@Builder
public class PerformanceReport {

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal winRate;
    private BigDecimal totalNetPnl;
    private BigDecimal grossProfit;
    private BigDecimal grossLoss;
    private BigDecimal profitFactor;
    private boolean profitFactorUnbounded;
    private BigDecimal averageWin;
    private BigDecimal averageLoss;
    private BigDecimal largestWin;
    private BigDecimal largestLoss;
    private BigDecimal maxDrawdown;
    private BigDecimal maxDrawdownPercent;
    private BigDecimal sharpeRatio;
    private int maxConsecutiveWins;
    private int maxConsecutiveLosses;
    private long averageHoldingSeconds;
    private BigDecimal totalFees;

    public static PerformanceReport empty() {
        return PerformanceReport.builder()
                .winRate(BigDecimal.ZERO)
                .totalNetPnl(BigDecimal.ZERO)
                .grossProfit(BigDecimal.ZERO)
                .grossLoss(BigDecimal.ZERO)
                .profitFactor(BigDecimal.ZERO)
                .averageWin(BigDecimal.ZERO)
                .averageLoss(BigDecimal.ZERO)
                .largestWin(BigDecimal.ZERO)
                .largestLoss(BigDecimal.ZERO)
                .maxDrawdown(BigDecimal.ZERO)
                .maxDrawdownPercent(BigDecimal.ZERO)
                .sharpeRatio(BigDecimal.ZERO)
                .totalFees(BigDecimal.ZERO)
                .build();
    }
}
