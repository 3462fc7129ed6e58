package com.perptrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the accounts table. Keyed by account name.
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountEntity {

    @Id
    @Column(length = 64)
    private String name;

    @Column(name = "starting_equity", precision = 20, scale = 8, nullable = false)
    private BigDecimal startingEquity;

    @Column(precision = 20, scale = 8, nullable = false)
    private BigDecimal balance;

    @Column(name = "default_leverage")
    private int defaultLeverage;

    @Column(name = "maker_fee_rate", precision = 10, scale = 6)
    private BigDecimal makerFeeRate;

    @Column(name = "taker_fee_rate", precision = 10, scale = 6)
    private BigDecimal takerFeeRate;

    @Column(name = "realized_pnl", precision = 20, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "total_fees", precision = 20, scale = 8)
    private BigDecimal totalFees;

    @Column(name = "total_trades")
    private int totalTrades;

    @Column(name = "winning_trades")
    private int winningTrades;

    @Column(name = "losing_trades")
    private int losingTrades;

    @Column(name = "peak_equity", precision = 20, scale = 8)
    private BigDecimal peakEquity;

    @Column(name = "max_drawdown_percent", precision = 10, scale = 4)
    private BigDecimal maxDrawdownPercent;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
