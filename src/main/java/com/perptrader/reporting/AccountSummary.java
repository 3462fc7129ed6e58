package com.perptrader.reporting;

import com.perptrader.domain.model.Position;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time view of an account.
 *
 * <p>{@code equity = balance + lockedMargin + unrealizedPnl}. Unrealized PnL uses the most
 * recent marks available to whoever built the summary; positions without a mark count as
 * flat.
 */
@Data
@Builder
public class AccountSummary {

    private String accountName;
    private BigDecimal startingEquity;
    private BigDecimal balance;
    private BigDecimal lockedMargin;
    private BigDecimal unrealizedPnl;
    private BigDecimal equity;

    /** Gross realized PnL; fees are reported separately. */
    private BigDecimal realizedPnl;

    private BigDecimal totalFees;
    private BigDecimal netPnl;
    private BigDecimal returnPercent;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal winRate;
    private BigDecimal peakEquity;
    private BigDecimal maxDrawdownPercent;
    private List<Position> openPositions;
    private Instant generatedAt;
}
