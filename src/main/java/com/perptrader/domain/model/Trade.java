package com.perptrader.domain.model;

import com.perptrader.domain.enums.CloseReason;
import com.perptrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable record of one completed round trip. Created exactly once when a position
 * closes; performance statistics are computed from trades alone.
 *
 * <p>{@code netPnl = grossPnl - entryFee - exitFee}.
 */
@Value
@Builder
public class Trade {

    String id;
    String accountName;
    String positionId;
    String symbol;
    PositionSide side;
    BigDecimal size;
    int leverage;
    BigDecimal margin;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal grossPnl;
    BigDecimal entryFee;
    BigDecimal exitFee;
    BigDecimal netPnl;

    /** Net PnL as a percentage of the margin committed. */
    BigDecimal pnlPercent;

    CloseReason closeReason;
    String strategyId;
    Instant openedAt;
    Instant closedAt;

    public BigDecimal getTotalFees() {
        return entryFee.add(exitFee);
    }

    public Duration getHoldingDuration() {
        return Duration.between(openedAt, closedAt);
    }

    public boolean isWin() {
        return netPnl.signum() > 0;
    }
}
