package com.perptrader.bot;

import com.perptrader.domain.enums.CloseReason;
import com.perptrader.domain.enums.RunState;
import com.perptrader.domain.model.Bar;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.event.AccountSummaryEvent;
import com.perptrader.event.BotRunStateEvent;
import com.perptrader.event.TradeClosedEvent;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.marketdata.RetryingMarketDataClient;
import com.perptrader.reporting.AccountSummary;
import com.perptrader.reporting.AccountSummaryService;
import com.perptrader.simulator.CloseResult;
import com.perptrader.simulator.LedgerMath;
import com.perptrader.simulator.OpenRequest;
import com.perptrader.simulator.OpenResult;
import com.perptrader.simulator.RiskTrigger;
import com.perptrader.simulator.SimulationEngine;
import com.perptrader.simulator.Sizing;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.MarketSnapshot;
import com.perptrader.strategy.base.TradingStrategy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.support.TransactionOperations;

/**
 * One live bot run: a single logical thread that polls market data and drives a strategy
 * through the SimulationEngine until a breaker, a stop request or repeated failures end it.
 *
 * <p><b>Per tick:</b>
 * <ol>
 *   <li>Fetch bars, price, funding and sentiment for every symbol concurrently on the
 *       market-data pool; the results are joined with a deadline. Symbols without data are
 *       skipped for this tick.</li>
 *   <li>Inside one transaction: mark open positions, trail stops, fire stop-loss /
 *       take-profit / liquidation, then evaluate the strategy per symbol and act on OPEN and
 *       CLOSE decisions.</li>
 *   <li>After commit: notify the strategy of closes, publish closed trades, emit the periodic summary, evaluate breakers.</li>
 * </ol>
 *
 * <p><b>Threading:</b> ticks and stop handling all run on the run's own single-threaded
 * scheduler, so a stop request is processed only after an in-flight tick has committed or
 * rolled back. Nothing writes to the ledger after the run reports a terminal state.
 *
 * <p><b>Failures:</b> an exception inside a tick rolls that tick back and is logged;
 * {@value #MAX_CONSECUTIVE_FAILURES} consecutive failed ticks move the run to ERROR.
 *
 * <p>Stopping never closes positions. They stay open on the account and are listed in the
 * final summary.
 */
public class LiveBotRun implements RunHandle {

    private static final Logger log = LoggerFactory.getLogger(LiveBotRun.class);

    static final int MAX_CONSECUTIVE_FAILURES = 3;

    private final String runId;
    private final BotRunConfig config;
    private final TradingStrategy strategy;
    private final SimulationEngine engine;
    private final RetryingMarketDataClient marketDataClient;
    private final Executor marketDataExecutor;
    private final ScheduledExecutorService scheduler;
    private final TransactionOperations transactions;
    private final ApplicationEventPublisher eventPublisher;
    private final AccountSummaryService accountSummaryService;
    private final Clock clock;
    private final int barWindow;

    // ---- Lifecycle ----
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final List<RunBreaker> breakers = new ArrayList<>();
    private volatile Instant startedAt;
    private volatile Instant stoppedAt;
    private volatile String stopReason;
    private volatile BigDecimal startingEquity;

    // ---- Run-thread state ----
    private final SessionStats stats = new SessionStats();
    private final Map<String, BigDecimal> marks = new HashMap<>();
    private Instant lastSummaryAt;
    private int consecutiveFailures;

    public LiveBotRun(
            String runId,
            BotRunConfig config,
            TradingStrategy strategy,
            SimulationEngine engine,
            RetryingMarketDataClient marketDataClient,
            Executor marketDataExecutor,
            ScheduledExecutorService scheduler,
            TransactionOperations transactions,
            ApplicationEventPublisher eventPublisher,
            AccountSummaryService accountSummaryService,
            Clock clock) {
        this.runId = runId;
        this.config = config;
        this.strategy = strategy;
        this.engine = engine;
        this.marketDataClient = marketDataClient;
        this.marketDataExecutor = marketDataExecutor;
        this.scheduler = scheduler;
        this.transactions = transactions;
        this.eventPublisher = eventPublisher;
        this.accountSummaryService = accountSummaryService;
        this.clock = clock;
        this.barWindow = Math.max(config.getBarWindow(), strategy.getMinimumBarsRequired());
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        if (!state.compareAndSet(RunState.IDLE, RunState.RUNNING)) {
            throw new BusinessException(ErrorCode.CONFLICT, "Run " + runId + " was already started");
        }
        startedAt = clock.instant();
        lastSummaryAt = startedAt;
        if (config.getTimeLimit() != null) {
            breakers.add(new TimeLimitBreaker(startedAt, config.getTimeLimit()));
        }
        if (config.getMaxLossLimit() != null) {
            breakers.add(new LossLimitBreaker(config.getMaxLossLimit()));
        }

        log.info(
                "[{}] Bot run started: account={}, symbols={}, strategy={}, leverage={}x, size={}%, interval={}s",
                runId,
                config.getAccountName(),
                config.getSymbols(),
                strategy.getName(),
                config.getLeverage(),
                config.getPositionSizePercent(),
                config.getCheckInterval().toSeconds());
        if (barWindow > config.getBarWindow()) {
            log.info(
                    "[{}] Bar window widened from {} to {} to cover {} history",
                    runId,
                    config.getBarWindow(),
                    barWindow,
                    strategy.getName());
        }
        publishState(RunState.IDLE, RunState.RUNNING, "started");

        scheduler.scheduleWithFixedDelay(
                this::tick, 0, config.getCheckInterval().toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void requestStop(String reason) {
        if (state.get().isTerminal()) {
            return;
        }
        stopRequested.set(true);
        try {
            scheduler.execute(() -> finish(RunState.STOPPED_BY_SIGNAL, reason));
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Stop request after scheduler shutdown ignored: {}", runId, reason);
        }
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ========================
    // TICK
    // ========================

    /**
     * Runs one tick on the calling thread. The scheduler invokes this at the configured
     * interval; it is a no-op unless the run is RUNNING.
     */
    public void tick() {
        if (state.get() != RunState.RUNNING) {
            return;
        }
        Instant now = clock.instant();
        stats.recordTick();

        Map<String, MarketSnapshot> snapshots = fetchAll(now);
        snapshots.forEach((symbol, snapshot) -> marks.put(symbol, snapshot.getLastPrice()));
        if (startingEquity == null) {
            startingEquity = summarize(now).getEquity();
            log.info("[{}] Run-start equity {}", runId, startingEquity);
        }

        List<Trade> closedTrades = new ArrayList<>();
        try {
            transactions.executeWithoutResult(status -> process(snapshots, now, closedTrades));
            consecutiveFailures = 0;
        } catch (RuntimeException e) {
            consecutiveFailures++;
            stats.recordFailedTick();
            log.error(
                    "[{}] Tick failed and was rolled back ({}/{} consecutive): {}",
                    runId,
                    consecutiveFailures,
                    MAX_CONSECUTIVE_FAILURES,
                    e.getMessage(),
                    e);
            if (consecutiveFailures >= MAX_CONSECUTIVE_FAILURES) {
                finish(RunState.ERROR, consecutiveFailures + " consecutive failed ticks, last: " + e.getMessage());
            }
            return;
        }

        for (Trade trade : closedTrades) {
            strategy.onPositionClosed(trade);
            stats.recordTrade(trade);
            eventPublisher.publishEvent(new TradeClosedEvent(this, runId, trade));
        }
        accountSummaryService.recordMarks(config.getAccountName(), marks);

        AccountSummary summary = summarize(now);
        if (!now.isBefore(lastSummaryAt.plus(config.getSummaryInterval()))) {
            logSummary(summary, false);
            eventPublisher.publishEvent(new AccountSummaryEvent(this, runId, summary, false));
            lastSummaryAt = now;
        }

        BigDecimal equityChange = summary.getEquity().subtract(startingEquity);
        for (RunBreaker breaker : breakers) {
            Optional<BreakerTrip> trip = breaker.check(now, equityChange);
            if (trip.isPresent()) {
                finish(trip.get().getState(), trip.get().getReason());
                return;
            }
        }
    }

    private void process(Map<String, MarketSnapshot> snapshots, Instant now, List<Trade> closedTrades) {
        String account = config.getAccountName();
        // The strategy hears about closes only after commit, so a symbol closed in this tick
        // is not re-evaluated until the next one
        Set<String> closedThisTick = new HashSet<>();

        // Protective exits first, so decisions see the post-trigger book
        for (MarketSnapshot snapshot : snapshots.values()) {
            Optional<Position> open = engine.getOpenPosition(account, snapshot.getSymbol());
            if (open.isEmpty()) {
                continue;
            }
            Position position = open.get();
            BigDecimal price = snapshot.getLastPrice();
            engine.markToMarket(position, price);
            engine.updateTrailingStop(position, price);
            Optional<RiskTrigger> trigger = engine.checkRiskTriggers(position, price);
            if (trigger.isPresent()) {
                closePosition(position, trigger.get().getExitPrice(), trigger.get().getReason(), now, closedTrades);
                closedThisTick.add(snapshot.getSymbol());
            }
        }

        for (MarketSnapshot snapshot : snapshots.values()) {
            if (stopRequested.get()) {
                log.info("[{}] Stop requested, skipping remaining decisions", runId);
                return;
            }
            if (closedThisTick.contains(snapshot.getSymbol())) {
                continue;
            }
            Optional<Position> current = engine.getOpenPosition(account, snapshot.getSymbol());
            Decision decision = strategy.evaluate(snapshot, current);

            if (decision.isOpen() && current.isEmpty()) {
                openPosition(snapshot, decision, now);
            } else if (decision.isClose() && current.isPresent()) {
                log.info("[{}] {} strategy exit: {}", runId, snapshot.getSymbol(), decision.getReason());
                closePosition(current.get(), snapshot.getLastPrice(), CloseReason.STRATEGY_SIGNAL, now, closedTrades);
            } else {
                log.debug("[{}] {} HOLD: {}", runId, snapshot.getSymbol(), decision.getReason());
            }
        }
    }

    private void openPosition(MarketSnapshot snapshot, Decision decision, Instant now) {
        int openCount = engine.getOpenPositions(config.getAccountName()).size();
        if (openCount >= config.getMaxOpenPositions()) {
            log.info(
                    "[{}] {} {} signal ignored: {} of {} positions open",
                    runId,
                    snapshot.getSymbol(),
                    decision.getSide(),
                    openCount,
                    config.getMaxOpenPositions());
            return;
        }
        OpenResult result = engine.open(OpenRequest.builder()
                .accountName(config.getAccountName())
                .symbol(snapshot.getSymbol())
                .side(decision.getSide())
                .sizing(Sizing.balancePercent(config.getPositionSizePercent()))
                .leverage(config.getLeverage())
                .referencePrice(snapshot.getLastPrice())
                .stopLoss(decision.getStopLoss())
                .takeProfit(decision.getTakeProfit())
                .trailingStopPercent(decision.getTrailingStopPercent())
                .strategyId(strategy.getId())
                .timestamp(now)
                .build());
        if (result.isRejected()) {
            stats.recordRejectedOpen();
        } else {
            log.info(
                    "[{}] {} {} opened (confidence {}): {}",
                    runId,
                    decision.getSide(),
                    snapshot.getSymbol(),
                    decision.getConfidence(),
                    decision.getReason());
        }
    }

    private void closePosition(
            Position position, BigDecimal price, CloseReason reason, Instant now, List<Trade> closedTrades) {
        CloseResult result = engine.close(position, price, reason, now);
        if (!result.isRejected()) {
            closedTrades.add(result.getTrade());
        }
    }

    // ========================
    // MARKET DATA FAN-OUT
    // ========================

    private Map<String, MarketSnapshot> fetchAll(Instant now) {
        Map<String, CompletableFuture<Optional<MarketSnapshot>>> futures = new LinkedHashMap<>();
        for (String symbol : config.getSymbols()) {
            futures.put(symbol, CompletableFuture.supplyAsync(() -> fetchSnapshot(symbol, now), marketDataExecutor));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                    .get(config.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[{}] Market data fetch exceeded {}ms", runId, config.getFetchTimeout().toMillis());
        } catch (ExecutionException e) {
            log.warn("[{}] Market data fetch failed: {}", runId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Market data fetch interrupted", runId);
        }

        Map<String, MarketSnapshot> snapshots = new LinkedHashMap<>();
        futures.forEach((symbol, future) -> {
            Optional<MarketSnapshot> snapshot = future.isDone() && !future.isCompletedExceptionally()
                    ? future.join()
                    : Optional.empty();
            if (!future.isDone()) {
                future.cancel(true);
            }
            if (snapshot.isPresent()) {
                snapshots.put(symbol, snapshot.get());
            } else {
                stats.recordSkippedSymbol();
                log.warn("[{}] {} skipped this tick: no market data", runId, symbol);
            }
        });
        return snapshots;
    }

    private Optional<MarketSnapshot> fetchSnapshot(String symbol, Instant now) {
        try {
            Optional<List<Bar>> bars = marketDataClient.fetchBars(symbol, barWindow);
            if (bars.isEmpty() || bars.get().isEmpty()) {
                return Optional.empty();
            }
            Optional<BigDecimal> price = marketDataClient.fetchPrice(symbol);
            if (price.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(MarketSnapshot.builder()
                    .symbol(symbol)
                    .bars(bars.get())
                    .lastPrice(price.get())
                    .timestamp(now)
                    .fundingRate(marketDataClient.fetchFundingRate(symbol).orElse(null))
                    .sentiment(marketDataClient.fetchSentiment(symbol).orElse(null))
                    .build());
        } catch (RuntimeException e) {
            log.warn("[{}] Unexpected market data error for {}: {}", runId, symbol, e.getMessage());
            return Optional.empty();
        }
    }

    // ========================
    // TERMINATION AND REPORTING
    // ========================

    /** Moves to a terminal state, emits the final summary and stops scheduling. Run thread only. */
    private void finish(RunState terminal, String reason) {
        RunState previous = state.get();
        if (previous.isTerminal() || !state.compareAndSet(previous, terminal)) {
            return;
        }
        stoppedAt = clock.instant();
        stopReason = reason;
        if (terminal == RunState.ERROR) {
            log.error("[{}] Bot run stopped: {} ({})", runId, terminal, reason);
        } else {
            log.info("[{}] Bot run stopped: {} ({})", runId, terminal, reason);
        }

        try {
            AccountSummary summary = summarize(stoppedAt);
            logSummary(summary, true);
            for (Position position : summary.getOpenPositions()) {
                log.info(
                        "[{}] Left open: {} {} {} @ {} (unrealized {})",
                        runId,
                        position.getSide(),
                        position.getSize().stripTrailingZeros().toPlainString(),
                        position.getSymbol(),
                        position.getEntryPrice(),
                        LedgerMath.display(position.getUnrealizedPnl()));
            }
            eventPublisher.publishEvent(new AccountSummaryEvent(this, runId, summary, true));
        } catch (RuntimeException e) {
            log.error("[{}] Final summary unavailable: {}", runId, e.getMessage(), e);
        } finally {
            publishState(previous, terminal, reason);
            scheduler.shutdown();
            terminated.countDown();
        }
    }

    private AccountSummary summarize(Instant now) {
        return accountSummaryService.summarize(engine, config.getAccountName(), marks, now);
    }

    private void logSummary(AccountSummary summary, boolean finalSummary) {
        SessionStats.Snapshot session = stats.snapshot();
        log.info(
                "[{}] {} summary: equity {} (start {}), balance {}, unrealized {}, open {}, trades {} (W{}/L{}), "
                        + "best {}, worst {}, fees {}, rejected opens {}, skipped symbol-ticks {}",
                runId,
                finalSummary ? "Final" : "Periodic",
                summary.getEquity(),
                startingEquity,
                summary.getBalance(),
                summary.getUnrealizedPnl(),
                summary.getOpenPositions().size(),
                session.getTradesClosed(),
                session.getWinningTrades(),
                session.getLosingTrades(),
                LedgerMath.display(session.getBestTrade()),
                LedgerMath.display(session.getWorstTrade()),
                summary.getTotalFees(),
                session.getRejectedOpens(),
                session.getSkippedSymbolTicks());
    }

    private void publishState(RunState previous, RunState next, String reason) {
        eventPublisher.publishEvent(
                new BotRunStateEvent(this, runId, config.getAccountName(), previous, next, reason));
    }

    // ========================
    // STATUS
    // ========================

    @Override
    public String getRunId() {
        return runId;
    }

    @Override
    public String getAccountName() {
        return config.getAccountName();
    }

    @Override
    public RunState getState() {
        return state.get();
    }

    @Override
    public BotRunStatus getStatus() {
        return BotRunStatus.builder()
                .runId(runId)
                .accountName(config.getAccountName())
                .symbols(config.getSymbols())
                .strategyType(strategy.getType())
                .strategyId(strategy.getId())
                .state(state.get())
                .stopReason(stopReason)
                .startedAt(startedAt)
                .stoppedAt(stoppedAt)
                .startingEquity(startingEquity)
                .stats(stats.snapshot())
                .build();
    }

    public SessionStats.Snapshot getSessionStats() {
        return stats.snapshot();
    }
}
