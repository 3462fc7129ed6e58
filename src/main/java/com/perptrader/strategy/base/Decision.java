package com.perptrader.strategy.base;

import com.perptrader.domain.enums.DecisionType;
import com.perptrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a strategy wants done for one symbol on one evaluation.
 * <ul>
 *   <li><b>OPEN:</b> side, confidence (0-10), optional stop-loss, take-profit and trailing
 *       distance</li>
 *   <li><b>CLOSE:</b> reason text for the audit log</li>
 *   <li><b>HOLD:</b> nothing to do; the reason explains why when useful</li>
 * </ul>
 * "No signal" is a HOLD, never an exception.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Decision {

    private static final Decision HOLD = new Decision(DecisionType.HOLD, null, 0, null, null, null, null);

    DecisionType type;
    PositionSide side;
    double confidence;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal trailingStopPercent;
    String reason;

    public static Decision open(PositionSide side, double confidence, BigDecimal stopLoss, BigDecimal takeProfit) {
        return new Decision(DecisionType.OPEN, side, confidence, stopLoss, takeProfit, null, null);
    }

    public static Decision open(
            PositionSide side,
            double confidence,
            BigDecimal stopLoss,
            BigDecimal takeProfit,
            BigDecimal trailingStopPercent,
            String reason) {
        return new Decision(DecisionType.OPEN, side, confidence, stopLoss, takeProfit, trailingStopPercent, reason);
    }

    public static Decision close(String reason) {
        return new Decision(DecisionType.CLOSE, null, 0, null, null, null, reason);
    }

    public static Decision hold() {
        return HOLD;
    }

    public static Decision hold(String reason) {
        return new Decision(DecisionType.HOLD, null, 0, null, null, null, reason);
    }

    public boolean isOpen() {
        return type == DecisionType.OPEN;
    }

    public boolean isClose() {
        return type == DecisionType.CLOSE;
    }

    public boolean isHold() {
        return type == DecisionType.HOLD;
    }
}
