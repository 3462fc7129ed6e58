package com.perptrader.strategy.base;

import com.perptrader.domain.enums.StrategyType;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import java.util.Optional;

/**
 * The decision boundary between strategy logic and execution.
 *
 * <p>Implementations read market data and the current position and return a
 * {@link Decision}; they never touch the ledger. Drivers interpret decisions through the
 * SimulationEngine, which is what lets the same instance run under the live bot loop and
 * the backtest replayer.
 */
public interface TradingStrategy {

    String getId();

    String getName();

    StrategyType getType();

    /** Fewest bars {@link #evaluate} needs; with less history it returns HOLD. */
    int getMinimumBarsRequired();

    Decision evaluate(MarketSnapshot snapshot, Optional<Position> openPosition);

    /** Notifies the strategy that one of its positions closed. Drives the post-close cooldown. */
    default void onPositionClosed(Trade trade) {}
}
