package com.perptrader.bot;

import com.perptrader.api.dto.request.StartBotRequest;
import com.perptrader.domain.model.Account;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.exception.ResourceNotFoundException;
import com.perptrader.marketdata.RetryingMarketDataClient;
import com.perptrader.reporting.AccountSummaryService;
import com.perptrader.simulator.SimulationEngine;
import com.perptrader.strategy.StrategyFactory;
import com.perptrader.strategy.TimeBoundedStrategy;
import com.perptrader.strategy.base.TradingStrategy;
import com.perptrader.util.DurationParser;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Starts, stops and tracks live bot runs.
 *
 * <p>Only one non-terminal run may exist per account: the engine assumes a single writer
 * per account, and this is where that is enforced.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase so that on shutdown every active
 * run is stopped (STOPPED_BY_SIGNAL, positions left open, final summary emitted) before
 * the executors and the datasource go away.
 */
@Service
public class BotRunService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BotRunService.class);

    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(15);

    private final StrategyFactory strategyFactory;
    private final SimulationEngine simulationEngine;
    private final RetryingMarketDataClient marketDataClient;
    private final Executor marketDataExecutor;
    private final ExecutorService strategyExecutor;
    private final TransactionOperations transactions;
    private final ApplicationEventPublisher eventPublisher;
    private final AccountSummaryService accountSummaryService;
    private final Clock clock;
    private final BotRunConfig defaults;
    private final Duration strategyTimeout;

    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BotRunService(
            StrategyFactory strategyFactory,
            SimulationEngine simulationEngine,
            RetryingMarketDataClient marketDataClient,
            @Qualifier("marketDataExecutor") Executor marketDataExecutor,
            @Qualifier("strategyExecutor") ExecutorService strategyExecutor,
            TransactionOperations transactions,
            ApplicationEventPublisher eventPublisher,
            AccountSummaryService accountSummaryService,
            Clock clock,
            BotRunConfig defaults,
            @Value("${perptrader.strategy.timeout:10s}") String strategyTimeout) {
        this.strategyFactory = strategyFactory;
        this.simulationEngine = simulationEngine;
        this.marketDataClient = marketDataClient;
        this.marketDataExecutor = marketDataExecutor;
        this.strategyExecutor = strategyExecutor;
        this.transactions = transactions;
        this.eventPublisher = eventPublisher;
        this.accountSummaryService = accountSummaryService;
        this.clock = clock;
        this.defaults = defaults;
        this.strategyTimeout = DurationParser.parse(strategyTimeout);
    }

    // ========================
    // RUN CONTROL
    // ========================

    /**
     * Validates the request, creates the account if needed and starts a run.
     *
     * @throws BusinessException RUN_ALREADY_ACTIVE if the account already has an active run,
     *     VALIDATION_ERROR for bad durations or strategy options
     */
    public synchronized BotRunStatus start(StartBotRequest request) {
        String accountName = request.getAccountName();
        RunHandle active = findActiveRun(accountName);
        if (active != null) {
            throw new BusinessException(
                    ErrorCode.RUN_ALREADY_ACTIVE,
                    "Account " + accountName + " already has an active run",
                    Map.of("runId", active.getRunId()));
        }

        BotRunConfig config = resolveConfig(request);
        String runId = generateRunId();
        String name = request.getStrategyName() != null ? request.getStrategyName() : request.getStrategyType() + "-" + runId;
        TradingStrategy strategy = strategyFactory.create(request.getStrategyType(), name, request.getStrategyOptions());
        if (!strategyTimeout.isZero()) {
            strategy = new TimeBoundedStrategy(strategy, strategyExecutor, strategyTimeout);
        }

        transactions.executeWithoutResult(status ->
                simulationEngine.getOrCreateAccount(accountName, request.getStartingEquity(), clock.instant()));

        ScheduledExecutorService scheduler =
                Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("bot-" + runId + "-"));
        LiveBotRun run = new LiveBotRun(
                runId,
                config,
                strategy,
                simulationEngine,
                marketDataClient,
                marketDataExecutor,
                scheduler,
                transactions,
                eventPublisher,
                accountSummaryService,
                clock);
        runs.put(runId, run);
        run.start();
        return run.getStatus();
    }

    public BotRunStatus stop(String runId) {
        RunHandle run = getRun(runId);
        log.info("Stop requested for run {}", runId);
        run.requestStop("stop requested");
        return run.getStatus();
    }

    /**
     * Resets an account's ledger. Refused while a run is trading the account.
     *
     * @throws BusinessException RUN_ALREADY_ACTIVE while a run is active on the account,
     *     ACCOUNT_HAS_OPEN_POSITIONS if positions are still open
     * @throws ResourceNotFoundException if the account does not exist
     */
    public synchronized Account resetAccount(String accountName, BigDecimal startingEquity) {
        RunHandle active = findActiveRun(accountName);
        if (active != null) {
            throw new BusinessException(
                    ErrorCode.RUN_ALREADY_ACTIVE,
                    "Stop run " + active.getRunId() + " before resetting account " + accountName,
                    Map.of("runId", active.getRunId()));
        }
        if (simulationEngine.findAccount(accountName).isEmpty()) {
            throw new ResourceNotFoundException("Account", accountName);
        }
        Account account = transactions.execute(status -> simulationEngine.resetAccount(accountName, startingEquity));
        accountSummaryService.clearMarks(accountName);
        return account;
    }

    public BotRunStatus getStatus(String runId) {
        return getRun(runId).getStatus();
    }

    public List<BotRunStatus> listRuns() {
        return runs.values().stream()
                .map(RunHandle::getStatus)
                .sorted(Comparator.comparing(BotRunStatus::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public int getActiveRunCount() {
        return (int) runs.values().stream().filter(r -> !r.getState().isTerminal()).count();
    }

    public RunHandle findActiveRun(String accountName) {
        return runs.values().stream()
                .filter(r -> r.getAccountName().equals(accountName) && !r.getState().isTerminal())
                .findFirst()
                .orElse(null);
    }

    private RunHandle getRun(String runId) {
        RunHandle run = runs.get(runId);
        if (run == null) {
            throw new ResourceNotFoundException("Bot run", runId);
        }
        return run;
    }

    BotRunConfig resolveConfig(StartBotRequest request) {
        BotRunConfig.BotRunConfigBuilder builder = defaults.toBuilder()
                .accountName(request.getAccountName())
                .symbols(List.copyOf(request.getSymbols()));
        if (request.getLeverage() != null) {
            builder.leverage(request.getLeverage());
        }
        if (request.getPositionSizePercent() != null) {
            builder.positionSizePercent(request.getPositionSizePercent());
        }
        if (request.getMaxOpenPositions() != null) {
            builder.maxOpenPositions(request.getMaxOpenPositions());
        }
        if (request.getCheckInterval() != null) {
            builder.checkInterval(requirePositive(DurationParser.parse(request.getCheckInterval()), "checkInterval"));
        }
        if (request.getSummaryInterval() != null) {
            builder.summaryInterval(DurationParser.parse(request.getSummaryInterval()));
        }
        if (request.getTimeLimit() != null) {
            builder.timeLimit(requirePositive(DurationParser.parse(request.getTimeLimit()), "timeLimit"));
        }
        if (request.getMaxLossLimit() != null) {
            builder.maxLossLimit(request.getMaxLossLimit());
        }
        return builder.build();
    }

    private static Duration requirePositive(Duration duration, String field) {
        if (duration.isZero() || duration.isNegative()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, field + " must be positive");
        }
        return duration;
    }

    /** Format: RUN-A1B2C3D4 */
    String generateRunId() {
        return "RUN-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        running.set(true);
        log.info("BotRunService started");
    }

    @Override
    public void stop() {
        List<RunHandle> active = runs.values().stream()
                .filter(r -> !r.getState().isTerminal())
                .toList();
        if (!active.isEmpty()) {
            log.info("Shutdown: stopping {} active bot run(s)", active.size());
        }
        active.forEach(r -> r.requestStop("application shutdown"));
        for (RunHandle run : active) {
            try {
                if (!run.awaitTermination(SHUTDOWN_WAIT)) {
                    log.warn("Run {} did not stop within {}s", run.getRunId(), SHUTDOWN_WAIT.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for run {} to stop", run.getRunId());
                break;
            }
        }
        running.set(false);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Stop runs before other Spring components shut down (higher phase = earlier shutdown)
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
