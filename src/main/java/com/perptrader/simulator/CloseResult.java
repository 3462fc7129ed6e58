package com.perptrader.simulator;

import com.perptrader.domain.enums.RejectionReason;
import com.perptrader.domain.model.Trade;
import lombok.Getter;

/**
 * Outcome of a close: either the recorded trade, or a rejection (typically a repeated close).
 */
@Getter
public class CloseResult {

    private final Trade trade;
    private final RejectionReason rejectionReason;
    private final String message;

    private CloseResult(Trade trade, RejectionReason rejectionReason, String message) {
        this.trade = trade;
        this.rejectionReason = rejectionReason;
        this.message = message;
    }

    public static CloseResult closed(Trade trade) {
        return new CloseResult(trade, null, null);
    }

    public static CloseResult rejected(RejectionReason reason, String message) {
        return new CloseResult(null, reason, message);
    }

    public boolean isRejected() {
        return rejectionReason != null;
    }
}
