package com.perptrader.domain.enums;

/**
 * Strategy families known to the StrategyFactory.
 */
public enum StrategyType {
    BREAKOUT,
    MEAN_REVERSION,
    FUNDING_CARRY
}
