package com.perptrader.bot;

import com.perptrader.domain.enums.RunState;
import java.time.Duration;

/**
 * Control surface of one bot run: start, stop, status.
 */
public interface RunHandle {

    String getRunId();

    String getAccountName();

    RunState getState();

    BotRunStatus getStatus();

    /** Moves IDLE to RUNNING and schedules ticks. */
    void start();

    /**
     * Asks the run to stop after any in-flight tick. The run ends in STOPPED_BY_SIGNAL and
     * emits its final summary. No-op once terminal.
     */
    void requestStop(String reason);

    /** @return true if the run reached a terminal state within {@code timeout} */
    boolean awaitTermination(Duration timeout) throws InterruptedException;
}
