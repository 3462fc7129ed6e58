package com.perptrader.domain.model;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One exposure to one symbol under one account. At most one OPEN position exists per
 * (account, symbol); the engine enforces this and the positions table backs it with a
 * unique constraint.
 *
 * <p>Only the stop-loss (trailing updates) and the cached mark fields change while the
 * position is open. Closing converts it into a {@link Trade}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String accountName;
    private String symbol;
    private PositionSide side;
    private BigDecimal size;

    /** Fill price after slippage and tick rounding. */
    private BigDecimal entryPrice;

    /** Price the open was requested at, before slippage. */
    private BigDecimal referenceEntryPrice;

    private int leverage;
    private BigDecimal margin;
    private BigDecimal entryFee;
    private BigDecimal stopLoss;
    private BigDecimal takeProfit;

    /** Trailing distance as a fraction of price (0.015 = 1.5%). Null disables trailing. */
    private BigDecimal trailingStopPercent;

    private String strategyId;
    private PositionStatus status;
    private Instant openedAt;

    // Display cache, refreshed by mark-to-market. Never used for accounting.
    private BigDecimal lastPrice;
    private BigDecimal unrealizedPnl;

    private BigDecimal exitPrice;
    private Instant closedAt;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public BigDecimal getNotional() {
        return entryPrice.multiply(size);
    }
}
