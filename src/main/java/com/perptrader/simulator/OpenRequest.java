package com.perptrader.simulator;

import com.perptrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of {@link SimulationEngine#open}. A null leverage means the account default.
 * The timestamp comes from the driver: wall clock when live, bar time when replaying.
 */
@Value
@Builder
public class OpenRequest {

    String accountName;
    String symbol;
    PositionSide side;
    Sizing sizing;
    Integer leverage;
    BigDecimal referencePrice;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal trailingStopPercent;
    String strategyId;
    Instant timestamp;
}
