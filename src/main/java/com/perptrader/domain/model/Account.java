package com.perptrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A virtual trading identity and its cash ledger.
 *
 * <p>{@code balance} is free cash: margin locked by open positions has already been
 * debited from it. The engine maintains
 * {@code balance + lockedMargin = startingEquity + realizedPnl - totalFees}, which reduces
 * to {@code balance = startingEquity + realizedPnl - totalFees} once the account is flat.
 *
 * <p>Mutated only by the SimulationEngine. Accounts are never deleted, only reset.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String name;
    private BigDecimal startingEquity;
    private BigDecimal balance;
    private int defaultLeverage;
    private BigDecimal makerFeeRate;
    private BigDecimal takerFeeRate;

    /** Sum of gross PnL over all closed trades. */
    private BigDecimal realizedPnl;

    /** Sum of entry and exit fees paid, including fees of positions still open. */
    private BigDecimal totalFees;

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;

    /** High-water mark of realized equity. */
    private BigDecimal peakEquity;

    /** Largest peak-to-trough decline of realized equity, in percent of the peak. */
    private BigDecimal maxDrawdownPercent;

    private Instant createdAt;
    private Instant updatedAt;
}
