package com.perptrader.strategy.base;

import com.perptrader.domain.model.Bar;
import com.perptrader.domain.model.SentimentSignal;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Everything a strategy may read for one symbol at one evaluation.
 *
 * <p>{@code bars} is time-ordered, oldest first, and ends with the most recent closed bar.
 * {@code timestamp} is the evaluation time: wall clock when live, the last bar's time when
 * replaying. Strategies use it for cooldowns and holding durations.
 */
@Data
@Builder
public class MarketSnapshot {

    private String symbol;
    private List<Bar> bars;
    private BigDecimal lastPrice;
    private Instant timestamp;

    /** Funding rate in percent per funding interval, null when not available. */
    private BigDecimal fundingRate;

    /** Optional enrichment; null when no sentiment source is configured. */
    private SentimentSignal sentiment;

    public Bar lastBar() {
        return bars.get(bars.size() - 1);
    }

    public int barCount() {
        return bars == null ? 0 : bars.size();
    }
}
