package com.perptrader.event;

import com.perptrader.domain.enums.RunState;
import org.springframework.context.ApplicationEvent;

/** Published on every bot run state transition. */
public class BotRunStateEvent extends ApplicationEvent {

    private final String runId;
    private final String accountName;
    private final RunState previousState;
    private final RunState newState;
    private final String reason;

    public BotRunStateEvent(
            Object source, String runId, String accountName, RunState previousState, RunState newState, String reason) {
        super(source);
        this.runId = runId;
        this.accountName = accountName;
        this.previousState = previousState;
        this.newState = newState;
        this.reason = reason;
    }

    public String getRunId() {
        return runId;
    }

    public String getAccountName() {
        return accountName;
    }

    public RunState getPreviousState() {
        return previousState;
    }

    public RunState getNewState() {
        return newState;
    }

    public String getReason() {
        return reason;
    }
}
