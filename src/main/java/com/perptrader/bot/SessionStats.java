package com.perptrader.bot;

import com.perptrader.domain.model.Trade;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-run counters reported in status responses and the final summary. Written by the
 * run thread only; {@link #snapshot()} may be called from any thread.
 */
public class SessionStats {

    private int ticks;
    private int failedTicks;
    private int skippedSymbolTicks;
    private int tradesClosed;
    private int winningTrades;
    private int losingTrades;
    private int rejectedOpens;
    private BigDecimal bestTrade;
    private BigDecimal worstTrade;
    private BigDecimal grossProfit = BigDecimal.ZERO;
    private BigDecimal grossLoss = BigDecimal.ZERO;

    public synchronized void recordTick() {
        ticks++;
    }

    public synchronized void recordFailedTick() {
        failedTicks++;
    }

    public synchronized void recordSkippedSymbol() {
        skippedSymbolTicks++;
    }

    public synchronized void recordRejectedOpen() {
        rejectedOpens++;
    }

    public synchronized void recordTrade(Trade trade) {
        BigDecimal net = trade.getNetPnl();
        tradesClosed++;
        if (trade.isWin()) {
            winningTrades++;
            grossProfit = grossProfit.add(net);
        } else {
            losingTrades++;
            grossLoss = grossLoss.add(net.abs());
        }
        if (bestTrade == null || net.compareTo(bestTrade) > 0) {
            bestTrade = net;
        }
        if (worstTrade == null || net.compareTo(worstTrade) < 0) {
            worstTrade = net;
        }
    }

    public synchronized Snapshot snapshot() {
        return Snapshot.builder()
                .ticks(ticks)
                .failedTicks(failedTicks)
                .skippedSymbolTicks(skippedSymbolTicks)
                .tradesClosed(tradesClosed)
                .winningTrades(winningTrades)
                .losingTrades(losingTrades)
                .rejectedOpens(rejectedOpens)
                .bestTrade(bestTrade)
                .worstTrade(worstTrade)
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .build();
    }

    @Value
    @Builder
    public static class Snapshot {
        int ticks;
        int failedTicks;
        int skippedSymbolTicks;
        int tradesClosed;
        int winningTrades;
        int losingTrades;
        int rejectedOpens;
        BigDecimal bestTrade;
        BigDecimal worstTrade;
        BigDecimal grossProfit;
        BigDecimal grossLoss;
    }
}
