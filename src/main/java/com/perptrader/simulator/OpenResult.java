package com.perptrader.simulator;

import com.perptrader.domain.enums.RejectionReason;
import com.perptrader.domain.model.Order;
import com.perptrader.domain.model.Position;
import lombok.Getter;

/**
 * Outcome of an open: either the new position with its fill order, or a rejection.
 */
@Getter
public class OpenResult {

    private final Position position;
    private final Order order;
    private final RejectionReason rejectionReason;
    private final String message;

    private OpenResult(Position position, Order order, RejectionReason rejectionReason, String message) {
        this.position = position;
        this.order = order;
        this.rejectionReason = rejectionReason;
        this.message = message;
    }

    public static OpenResult opened(Position position, Order order) {
        return new OpenResult(position, order, null, null);
    }

    public static OpenResult rejected(RejectionReason reason, String message) {
        return new OpenResult(null, null, reason, message);
    }

    public boolean isRejected() {
        return rejectionReason != null;
    }
}
