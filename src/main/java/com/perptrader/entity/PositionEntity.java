package com.perptrader.entity;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.PositionStatus;
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
 * JPA entity for the positions table.
 *
 * <p>{@code open_symbol} holds the symbol while the position is OPEN and NULL once it is
 * closed. The unique constraint on (account_name, open_symbol) therefore allows any number
 * of closed rows but only one open row per account and symbol.
 */
@Entity
@Table(
        name = "positions",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_positions_account_open_symbol",
                        columnNames = {"account_name", "open_symbol"}),
        indexes = @Index(name = "idx_positions_account_status", columnList = "account_name, status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "account_name", length = 64, nullable = false)
    private String accountName;

    @Column(length = 32, nullable = false)
    private String symbol;

    @Column(name = "open_symbol", length = 32)
    private String openSymbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private PositionSide side;

    @Column(precision = 24, scale = 8)
    private BigDecimal size;

    @Column(name = "entry_price", precision = 20, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "reference_entry_price", precision = 20, scale = 8)
    private BigDecimal referenceEntryPrice;

    private int leverage;

    @Column(precision = 20, scale = 8)
    private BigDecimal margin;

    @Column(name = "entry_fee", precision = 20, scale = 8)
    private BigDecimal entryFee;

    @Column(name = "stop_loss", precision = 20, scale = 8)
    private BigDecimal stopLoss;

    @Column(name = "take_profit", precision = 20, scale = 8)
    private BigDecimal takeProfit;

    @Column(name = "trailing_stop_percent", precision = 10, scale = 6)
    private BigDecimal trailingStopPercent;

    @Column(name = "strategy_id", length = 64)
    private String strategyId;

    @Enumerated(EnumType.STRING)
    @Column(length = 8, nullable = false)
    private PositionStatus status;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "exit_price", precision = 20, scale = 8)
    private BigDecimal exitPrice;

    @Column(name = "closed_at")
    private Instant closedAt;
}
