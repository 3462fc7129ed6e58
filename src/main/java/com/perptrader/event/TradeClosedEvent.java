package com.perptrader.event;

import com.perptrader.domain.model.Trade;
import org.springframework.context.ApplicationEvent;

/**
 * Published by a bot run each time one of its positions closes, whatever the reason.
 * This is the closed-trade feed; the trade is immutable and already persisted.
 */
public class TradeClosedEvent extends ApplicationEvent {

    private final String runId;
    private final Trade trade;

    public TradeClosedEvent(Object source, String runId, Trade trade) {
        super(source);
        this.runId = runId;
        this.trade = trade;
    }

    public String getRunId() {
        return runId;
    }

    public Trade getTrade() {
        return trade;
    }
}
