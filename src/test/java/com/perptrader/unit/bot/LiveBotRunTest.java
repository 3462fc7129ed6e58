package com.perptrader.unit.bot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.perptrader.bot.BotRunConfig;
import com.perptrader.bot.LiveBotRun;
import com.perptrader.domain.enums.CloseReason;
import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.RunState;
import com.perptrader.domain.model.Bar;
import com.perptrader.event.AccountSummaryEvent;
import com.perptrader.event.TradeClosedEvent;
import com.perptrader.exception.BusinessException;
import com.perptrader.ledger.InMemoryLedgerRepository;
import com.perptrader.marketdata.RetryingMarketDataClient;
import com.perptrader.reporting.AccountSummaryService;
import com.perptrader.simulator.AccountDefaults;
import com.perptrader.simulator.EngineSettings;
import com.perptrader.simulator.SimulationEngine;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.TradingStrategy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.UnexpectedRollbackException;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Unit tests for LiveBotRun.
 *
 * <p>Ticks are driven by hand on the test thread: the scheduler is a mock whose
 * {@code execute} runs inline, market data is fetched on a direct executor and the clock is
 * advanced manually. The ledger is the real engine over the in-memory repository.
 */
@ExtendWith(MockitoExtension.class)
class LiveBotRunTest {

    private static final String ACCOUNT = "paper";
    private static final String SYMBOL = "BTCUSDT";
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private RetryingMarketDataClient marketData;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ApplicationEventPublisher publisher;

    @Mock
    private TradingStrategy strategy;

    private SimulationEngine engine;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        engine = new SimulationEngine(
                new InMemoryLedgerRepository(),
                EngineSettings.builder().build(),
                AccountDefaults.builder().build());
        engine.getOrCreateAccount(ACCOUNT, new BigDecimal("10000"), T0);
        clock = new MutableClock(T0);

        lenient().doAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        }).when(scheduler).execute(any(Runnable.class));
        lenient().when(marketData.fetchBars(anyString(), anyInt())).thenReturn(Optional.of(List.of(bar())));
        lenient().when(strategy.getName()).thenReturn("scripted");
    }

    @Nested
    @DisplayName("Breakers")
    class Breakers {

        @Test
        @DisplayName("Loss floor stops the run and no further decisions are taken")
        void lossLimit_stopsRun() {
            LiveBotRun run = run(baseConfig().maxLossLimit(new BigDecimal("50")).build());
            when(strategy.evaluate(any(), any())).thenReturn(Decision.open(PositionSide.LONG, 8, null, null));
            run.start();

            priceAt("100");
            run.tick();
            assertThat(run.getState()).isEqualTo(RunState.RUNNING);

            priceAt("90");
            run.tick();
            assertThat(run.getState()).isEqualTo(RunState.STOPPED_BY_LOSS_LIMIT);

            run.tick();
            verify(strategy, times(2)).evaluate(any(), any());
            assertThat(engine.getOpenPositions(ACCOUNT)).hasSize(1);
            assertThat(run.getStatus().getStopReason()).contains("reached floor -50");
        }

        @Test
        @DisplayName("Time limit stops the run once elapsed")
        void timeLimit_stopsRun() {
            LiveBotRun run = run(baseConfig().timeLimit(Duration.ofMinutes(10)).build());
            when(strategy.evaluate(any(), any())).thenReturn(Decision.hold());
            priceAt("100");
            run.start();

            run.tick();
            clock.advance(Duration.ofMinutes(9));
            run.tick();
            assertThat(run.getState()).isEqualTo(RunState.RUNNING);

            clock.advance(Duration.ofMinutes(1));
            run.tick();
            assertThat(run.getState()).isEqualTo(RunState.STOPPED_BY_TIME_LIMIT);
            assertThat(run.getStatus().getStoppedAt()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        }
    }

    @Nested
    @DisplayName("Ticks")
    class Ticks {

        @Test
        @DisplayName("Stop-loss crossed between ticks closes the position and publishes the trade")
        void stopLoss_publishesClosedTrade() {
            LiveBotRun run = run(baseConfig().build());
            when(strategy.evaluate(any(), any()))
                    .thenReturn(Decision.open(PositionSide.LONG, 8, new BigDecimal("95"), null))
                    .thenReturn(Decision.hold());
            run.start();

            priceAt("100");
            run.tick();
            priceAt("94");
            run.tick();

            ArgumentCaptor<ApplicationEvent> events = ArgumentCaptor.forClass(ApplicationEvent.class);
            verify(publisher, atLeastOnce()).publishEvent(events.capture());
            List<TradeClosedEvent> trades = events.getAllValues().stream()
                    .filter(TradeClosedEvent.class::isInstance)
                    .map(TradeClosedEvent.class::cast)
                    .toList();
            assertThat(trades).hasSize(1);
            assertThat(trades.get(0).getTrade().getCloseReason()).isEqualTo(CloseReason.STOP_LOSS);
            assertThat(trades.get(0).getRunId()).isEqualTo("RUN-TEST");
            verify(strategy).onPositionClosed(trades.get(0).getTrade());
            assertThat(run.getSessionStats().getTradesClosed()).isEqualTo(1);
            assertThat(engine.getOpenPositions(ACCOUNT)).isEmpty();
        }

        @Test
        @DisplayName("Symbol closed by a protective exit is not re-evaluated in the same tick")
        void protectiveExit_skipsDecisionThisTick() {
            LiveBotRun run = run(baseConfig().build());
            when(strategy.evaluate(any(), any()))
                    .thenReturn(Decision.open(PositionSide.LONG, 8, new BigDecimal("95"), null));
            run.start();

            priceAt("100");
            run.tick();
            priceAt("94");
            run.tick();

            verify(strategy, times(1)).evaluate(any(), any());
            assertThat(engine.getOpenPositions(ACCOUNT)).isEmpty();
        }

        @Test
        @DisplayName("Close in a tick that fails to commit is not reported to the strategy")
        void rolledBackClose_notReported() {
            CommitFailingTransactions transactions = new CommitFailingTransactions();
            LiveBotRun run = run(baseConfig().build(), transactions);
            when(strategy.evaluate(any(), any()))
                    .thenReturn(Decision.open(PositionSide.LONG, 8, new BigDecimal("95"), null));
            run.start();

            priceAt("100");
            run.tick();
            transactions.failCommit = true;
            priceAt("94");
            run.tick();

            verify(strategy, never()).onPositionClosed(any());
            verify(publisher, never()).publishEvent(any(TradeClosedEvent.class));
            assertThat(run.getSessionStats().getFailedTicks()).isEqualTo(1);
            assertThat(run.getSessionStats().getTradesClosed()).isZero();
        }

        @Test
        @DisplayName("Bar window is widened to the strategy's minimum history")
        void barWindow_coversStrategyHistory() {
            when(strategy.getMinimumBarsRequired()).thenReturn(150);
            when(strategy.evaluate(any(), any())).thenReturn(Decision.hold());
            LiveBotRun run = run(baseConfig().barWindow(100).build());
            priceAt("100");
            run.start();

            run.tick();

            verify(marketData).fetchBars(SYMBOL, 150);
        }

        @Test
        @DisplayName("Bar window is kept when it already covers the strategy")
        void barWindow_keptWhenLargeEnough() {
            when(strategy.getMinimumBarsRequired()).thenReturn(30);
            when(strategy.evaluate(any(), any())).thenReturn(Decision.hold());
            LiveBotRun run = run(baseConfig().barWindow(100).build());
            priceAt("100");
            run.start();

            run.tick();

            verify(marketData).fetchBars(SYMBOL, 100);
        }

        @Test
        @DisplayName("Symbol without market data is skipped without evaluating")
        void missingData_skipsSymbol() {
            LiveBotRun run = run(baseConfig().build());
            when(marketData.fetchBars(anyString(), anyInt())).thenReturn(Optional.empty());
            run.start();

            run.tick();

            verify(strategy, never()).evaluate(any(), any());
            assertThat(run.getSessionStats().getSkippedSymbolTicks()).isEqualTo(1);
            assertThat(run.getState()).isEqualTo(RunState.RUNNING);
        }

        @Test
        @DisplayName("Three consecutive failed ticks move the run to ERROR")
        void repeatedFailures_error() {
            LiveBotRun run = run(baseConfig().build());
            when(strategy.evaluate(any(), any())).thenThrow(new IllegalStateException("boom"));
            priceAt("100");
            run.start();

            run.tick();
            run.tick();
            assertThat(run.getState()).isEqualTo(RunState.RUNNING);

            run.tick();
            assertThat(run.getState()).isEqualTo(RunState.ERROR);
            assertThat(run.getSessionStats().getFailedTicks()).isEqualTo(3);
            assertThat(run.getStatus().getStopReason()).contains("boom");
        }

        @Test
        @DisplayName("A successful tick resets the failure count")
        void successResetsFailureCount() {
            LiveBotRun run = run(baseConfig().build());
            when(strategy.evaluate(any(), any()))
                    .thenThrow(new IllegalStateException("boom"))
                    .thenThrow(new IllegalStateException("boom"))
                    .thenReturn(Decision.hold())
                    .thenThrow(new IllegalStateException("boom"));
            priceAt("100");
            run.start();

            for (int i = 0; i < 4; i++) {
                run.tick();
            }

            assertThat(run.getState()).isEqualTo(RunState.RUNNING);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Stop request ends the run with a final summary and leaves positions open")
        void requestStop_emitsFinalSummary() throws InterruptedException {
            LiveBotRun run = run(baseConfig().build());
            when(strategy.evaluate(any(), any())).thenReturn(Decision.open(PositionSide.SHORT, 8, null, null));
            priceAt("100");
            run.start();
            run.tick();

            run.requestStop("stop requested");
            run.tick();

            assertThat(run.getState()).isEqualTo(RunState.STOPPED_BY_SIGNAL);
            assertThat(run.awaitTermination(Duration.ZERO)).isTrue();
            assertThat(engine.getOpenPositions(ACCOUNT)).hasSize(1);
            verify(strategy, times(1)).evaluate(any(), any());
            verify(scheduler).shutdown();

            ArgumentCaptor<ApplicationEvent> events = ArgumentCaptor.forClass(ApplicationEvent.class);
            verify(publisher, atLeastOnce()).publishEvent(events.capture());
            assertThat(events.getAllValues())
                    .filteredOn(AccountSummaryEvent.class::isInstance)
                    .map(AccountSummaryEvent.class::cast)
                    .anySatisfy(e -> {
                        assertThat(e.isFinalSummary()).isTrue();
                        assertThat(e.getSummary().getOpenPositions()).hasSize(1);
                    });
        }

        @Test
        @DisplayName("A run cannot be started twice")
        void startTwice_conflict() {
            LiveBotRun run = run(baseConfig().build());
            run.start();

            assertThatThrownBy(run::start).isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("Tick before start is a no-op")
        void tickBeforeStart_noop() {
            LiveBotRun run = run(baseConfig().build());

            run.tick();

            assertThat(run.getState()).isEqualTo(RunState.IDLE);
            verify(strategy, never()).evaluate(any(), any());
        }
    }

    // ---- helpers ----

    private LiveBotRun run(BotRunConfig config) {
        return run(config, TransactionOperations.withoutTransaction());
    }

    private LiveBotRun run(BotRunConfig config, TransactionOperations transactions) {
        return new LiveBotRun(
                "RUN-TEST",
                config,
                strategy,
                engine,
                marketData,
                Runnable::run,
                scheduler,
                transactions,
                publisher,
                new AccountSummaryService(engine),
                clock);
    }

    private BotRunConfig.BotRunConfigBuilder baseConfig() {
        return BotRunConfig.builder()
                .accountName(ACCOUNT)
                .symbols(List.of(SYMBOL))
                .leverage(2)
                .positionSizePercent(new BigDecimal("10"))
                .summaryInterval(Duration.ofHours(1));
    }

    private void priceAt(String price) {
        when(marketData.fetchPrice(SYMBOL)).thenReturn(Optional.of(new BigDecimal(price)));
    }

    private static Bar bar() {
        return Bar.builder()
                .timestamp(T0)
                .open(new BigDecimal("100"))
                .high(new BigDecimal("101"))
                .low(new BigDecimal("99"))
                .close(new BigDecimal("100"))
                .volume(BigDecimal.TEN)
                .build();
    }

    /** Runs the callback, then fails the commit when asked to. */
    private static final class CommitFailingTransactions implements TransactionOperations {

        private boolean failCommit;

        @Override
        public <T> T execute(TransactionCallback<T> action) {
            T result = action.doInTransaction(new SimpleTransactionStatus());
            if (failCommit) {
                throw new UnexpectedRollbackException("commit failed");
            }
            return result;
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
