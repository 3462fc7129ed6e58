package com.perptrader.event;

import com.perptrader.reporting.AccountSummary;
import org.springframework.context.ApplicationEvent;

/**
 * Periodic account summary from a running bot, plus the final one when the run stops
 * ({@code finalSummary = true}).
 */
public class AccountSummaryEvent extends ApplicationEvent {

    private final String runId;
    private final AccountSummary summary;
    private final boolean finalSummary;

    public AccountSummaryEvent(Object source, String runId, AccountSummary summary, boolean finalSummary) {
        super(source);
        this.runId = runId;
        this.summary = summary;
        this.finalSummary = finalSummary;
    }

    public String getRunId() {
        return runId;
    }

    public AccountSummary getSummary() {
        return summary;
    }

    public boolean isFinalSummary() {
        return finalSummary;
    }
}
