package com.perptrader.domain.enums;

/**
 * Lifecycle of a bot run. IDLE and RUNNING are the only non-terminal states.
 */
public enum RunState {
    IDLE,
    RUNNING,
    STOPPED_BY_TIME_LIMIT,
    STOPPED_BY_LOSS_LIMIT,
    STOPPED_BY_SIGNAL,
    ERROR;

    public boolean isTerminal() {
        return this != IDLE && this != RUNNING;
    }
}
