package com.perptrader.entity;

import com.perptrader.domain.enums.CloseReason;
import com.perptrader.domain.enums.PositionSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table. Rows are insert-only. The unique constraint on
 * position_id guarantees that a position produces at most one trade.
 */
@Entity
@Table(
        name = "trades",
        uniqueConstraints = @UniqueConstraint(name = "uk_trades_position", columnNames = "position_id"),
        indexes = @Index(name = "idx_trades_account_closed", columnList = "account_name, closed_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "account_name", length = 64, nullable = false)
    private String accountName;

    @Column(name = "position_id", length = 36, nullable = false)
    private String positionId;

    @Column(length = 32, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private PositionSide side;

    @Column(precision = 24, scale = 8)
    private BigDecimal size;

    private int leverage;

    @Column(precision = 20, scale = 8)
    private BigDecimal margin;

    @Column(name = "entry_price", precision = 20, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "exit_price", precision = 20, scale = 8)
    private BigDecimal exitPrice;

    @Column(name = "gross_pnl", precision = 20, scale = 8)
    private BigDecimal grossPnl;

    @Column(name = "entry_fee", precision = 20, scale = 8)
    private BigDecimal entryFee;

    @Column(name = "exit_fee", precision = 20, scale = 8)
    private BigDecimal exitFee;

    @Column(name = "net_pnl", precision = 20, scale = 8)
    private BigDecimal netPnl;

    @Column(name = "pnl_percent", precision = 12, scale = 4)
    private BigDecimal pnlPercent;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", length = 20)
    private CloseReason closeReason;

    @Column(name = "strategy_id", length = 64)
    private String strategyId;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;
}
