package com.perptrader.unit.bot;

import static org.assertj.core.api.Assertions.assertThat;

import com.perptrader.bot.SessionStats;
import com.perptrader.domain.model.Trade;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class SessionStatsTest {

    @Test
    void recordsTradesAndCounters() {
        SessionStats stats = new SessionStats();

        stats.recordTick();
        stats.recordTick();
        stats.recordFailedTick();
        stats.recordSkippedSymbol();
        stats.recordRejectedOpen();
        stats.recordTrade(trade("40"));
        stats.recordTrade(trade("-15"));
        stats.recordTrade(trade("0"));

        SessionStats.Snapshot snapshot = stats.snapshot();
        assertThat(snapshot.getTicks()).isEqualTo(2);
        assertThat(snapshot.getFailedTicks()).isEqualTo(1);
        assertThat(snapshot.getSkippedSymbolTicks()).isEqualTo(1);
        assertThat(snapshot.getRejectedOpens()).isEqualTo(1);
        assertThat(snapshot.getTradesClosed()).isEqualTo(3);
        assertThat(snapshot.getWinningTrades()).isEqualTo(1);
        // a flat trade counts as a loss
        assertThat(snapshot.getLosingTrades()).isEqualTo(2);
        assertThat(snapshot.getBestTrade()).isEqualByComparingTo("40");
        assertThat(snapshot.getWorstTrade()).isEqualByComparingTo("-15");
        assertThat(snapshot.getGrossProfit()).isEqualByComparingTo("40");
        assertThat(snapshot.getGrossLoss()).isEqualByComparingTo("15");
    }

    @Test
    void emptySession_hasNoBestOrWorst() {
        SessionStats.Snapshot snapshot = new SessionStats().snapshot();

        assertThat(snapshot.getTradesClosed()).isZero();
        assertThat(snapshot.getBestTrade()).isNull();
        assertThat(snapshot.getGrossProfit()).isEqualByComparingTo("0");
    }

    private static Trade trade(String netPnl) {
        return Trade.builder().netPnl(new BigDecimal(netPnl)).build();
    }
}
