package com.perptrader.observability;

import com.perptrader.bot.BotRunService;
import com.perptrader.domain.model.Trade;
import com.perptrader.event.BotRunStateEvent;
import com.perptrader.event.TradeClosedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the paper-trading loop:
 * <ul>
 *   <li><b>trades.closed</b> (counter, tags reason and outcome): one per closed trade</li>
 *   <li><b>trades.fees</b> (counter): total fees paid on closed trades</li>
 *   <li><b>bot.runs.stopped</b> (counter, tag state): terminal run transitions</li>
 *   <li><b>bot.runs.active</b> (gauge): runs in IDLE or RUNNING</li>
 * </ul>
 *
 * <p>Listeners run at {@code @Order(20)}, after the trade feed has recorded the event.
 */
@Service
public class TradingMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter feesCounter;

    public TradingMetricsService(MeterRegistry meterRegistry, BotRunService botRunService) {
        this.meterRegistry = meterRegistry;
        this.feesCounter = Counter.builder("trades.fees")
                .description("Total entry and exit fees paid on closed trades")
                .register(meterRegistry);

        meterRegistry.gauge("bot.runs.active", botRunService, BotRunService::getActiveRunCount);
    }

    @EventListener
    @Order(20)
    public void onTradeClosed(TradeClosedEvent event) {
        Trade trade = event.getTrade();
        Counter.builder("trades.closed")
                .description("Closed trades by close reason and outcome")
                .tag("reason", trade.getCloseReason().name())
                .tag("outcome", trade.isWin() ? "win" : "loss")
                .register(meterRegistry)
                .increment();
        feesCounter.increment(trade.getTotalFees().doubleValue());
    }

    @EventListener
    @Order(20)
    public void onRunStateChanged(BotRunStateEvent event) {
        if (event.getNewState().isTerminal()) {
            Counter.builder("bot.runs.stopped")
                    .description("Bot runs reaching a terminal state")
                    .tag("state", event.getNewState().name())
                    .register(meterRegistry)
                    .increment();
        }
    }
}
