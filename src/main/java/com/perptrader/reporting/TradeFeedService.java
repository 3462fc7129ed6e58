package com.perptrader.reporting;

import com.perptrader.domain.model.Trade;
import com.perptrader.event.AccountSummaryEvent;
import com.perptrader.event.TradeClosedEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Consumer of bot-run events. Keeps the most recent closed trades of every run (the
 * closed-trade feed) and the last summary each run emitted.
 */
@Service
public class TradeFeedService {

    private static final Logger log = LoggerFactory.getLogger(TradeFeedService.class);

    private final int capacity;
    private final Map<String, Deque<Trade>> feeds = new ConcurrentHashMap<>();
    private final Map<String, AccountSummary> latestSummaries = new ConcurrentHashMap<>();

    public TradeFeedService(@Value("${perptrader.bot.trade-feed-size:200}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @EventListener
    public void onTradeClosed(TradeClosedEvent event) {
        Trade trade = event.getTrade();
        Deque<Trade> feed = feeds.computeIfAbsent(event.getRunId(), k -> new ArrayDeque<>());
        synchronized (feed) {
            feed.addLast(trade);
            while (feed.size() > capacity) {
                feed.removeFirst();
            }
        }
        log.debug("[{}] Trade {} added to feed", event.getRunId(), trade.getId());
    }

    @EventListener
    public void onSummary(AccountSummaryEvent event) {
        latestSummaries.put(event.getRunId(), event.getSummary());
    }

    /** Closed trades of a run, oldest first; empty for unknown runs. */
    public List<Trade> recentTrades(String runId) {
        Deque<Trade> feed = feeds.get(runId);
        if (feed == null) {
            return List.of();
        }
        synchronized (feed) {
            return List.copyOf(feed);
        }
    }

    public Optional<AccountSummary> latestSummary(String runId) {
        return Optional.ofNullable(latestSummaries.get(runId));
    }
}
