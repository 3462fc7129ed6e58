package com.perptrader.domain.model;

import com.perptrader.domain.enums.OrderSide;
import com.perptrader.domain.enums.OrderStatus;
import com.perptrader.domain.enums.OrderType;
import com.perptrader.domain.enums.RejectionReason;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit record of one requested change to a position. The gap between
 * {@code requestedPrice} and {@code fillPrice} is the applied slippage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;
    private String accountName;
    private String positionId;
    private String symbol;
    private OrderType type;
    private OrderSide side;
    private BigDecimal size;
    private BigDecimal requestedPrice;
    private BigDecimal fillPrice;
    private BigDecimal slippage;
    private BigDecimal fee;
    private OrderStatus status;
    private RejectionReason rejectionReason;
    private String message;
    private Instant createdAt;
}
