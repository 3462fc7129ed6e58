package com.perptrader.strategy;

import com.perptrader.domain.enums.StrategyType;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.MarketSnapshot;
import com.perptrader.strategy.base.TradingStrategy;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that bounds how long one {@link TradingStrategy#evaluate} call may take.
 *
 * <p>The call runs on {@code executor}; when {@code timeout} elapses the future is
 * cancelled (interrupting the worker) and HOLD is returned, so a slow enrichment call
 * never stalls the tick. Runtime exceptions thrown by the delegate propagate unchanged.
 */
public class TimeBoundedStrategy implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(TimeBoundedStrategy.class);

    private final TradingStrategy delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeBoundedStrategy(TradingStrategy delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public Decision evaluate(MarketSnapshot snapshot, Optional<Position> openPosition) {
        Future<Decision> future = executor.submit(() -> delegate.evaluate(snapshot, openPosition));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] {} evaluation exceeded {}ms, holding", delegate.getName(), snapshot.getSymbol(), timeout.toMillis());
            return Decision.hold("evaluation timed out");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Decision.hold("evaluation interrupted");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Strategy evaluation failed", e.getCause());
        }
    }

    @Override
    public void onPositionClosed(Trade trade) {
        delegate.onPositionClosed(trade);
    }

    @Override
    public String getId() {
        return delegate.getId();
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public StrategyType getType() {
        return delegate.getType();
    }

    @Override
    public int getMinimumBarsRequired() {
        return delegate.getMinimumBarsRequired();
    }

    public TradingStrategy getDelegate() {
        return delegate;
    }
}
