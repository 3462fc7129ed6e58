package com.perptrader.entity;

import com.perptrader.domain.enums.OrderSide;
import com.perptrader.domain.enums.OrderStatus;
import com.perptrader.domain.enums.OrderType;
import com.perptrader.domain.enums.RejectionReason;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the orders table (fill and rejection audit trail).
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "account_name", length = 64, nullable = false)
    private String accountName;

    @Column(name = "position_id", length = 36)
    private String positionId;

    @Column(length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private OrderType type;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private OrderSide side;

    @Column(precision = 24, scale = 8)
    private BigDecimal size;

    @Column(name = "requested_price", precision = 20, scale = 8)
    private BigDecimal requestedPrice;

    @Column(name = "fill_price", precision = 20, scale = 8)
    private BigDecimal fillPrice;

    @Column(precision = 20, scale = 8)
    private BigDecimal slippage;

    @Column(precision = 20, scale = 8)
    private BigDecimal fee;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_reason", length = 24)
    private RejectionReason rejectionReason;

    @Column(length = 255)
    private String message;

    @Column(name = "created_at")
    private Instant createdAt;
}
