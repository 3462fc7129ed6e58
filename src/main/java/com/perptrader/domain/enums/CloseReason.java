package com.perptrader.domain.enums;

/**
 * Why a position was closed. END_OF_DATA marks positions force-closed by the backtest
 * replayer when the series runs out, so they can be told apart from strategy exits.
 */
public enum CloseReason {
    STOP_LOSS,
    TAKE_PROFIT,
    STRATEGY_SIGNAL,
    MANUAL,
    LIQUIDATION,
    END_OF_DATA;

    public OrderType toOrderType() {
        return switch (this) {
            case STOP_LOSS -> OrderType.STOP_LOSS;
            case TAKE_PROFIT -> OrderType.TAKE_PROFIT;
            case LIQUIDATION -> OrderType.LIQUIDATION;
            default -> OrderType.MARKET_CLOSE;
        };
    }
}
