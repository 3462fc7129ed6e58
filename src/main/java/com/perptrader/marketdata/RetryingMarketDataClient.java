package com.perptrader.marketdata;

import com.perptrader.domain.model.Bar;
import com.perptrader.domain.model.SentimentSignal;
import com.perptrader.exception.MarketDataException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fronts the market-data ports with a resilience4j {@link Retry} using bounded exponential
 * backoff.
 *
 * <p>Only {@link MarketDataException} is retried. Up to {@code maxAttempts} calls are made,
 * waiting {@code baseDelayMs * 2^(attempt-1)} (capped at {@code maxDelayMs}) in between.
 * On exhaustion the result is empty and the caller skips that symbol for the tick. Any
 * other exception propagates on the first attempt.
 *
 * <p>Funding and sentiment sources are optional; without them those lookups are empty.
 */
public class RetryingMarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingMarketDataClient.class);

    private final BarSource barSource;
    private final PriceSource priceSource;
    private final FundingRateSource fundingRateSource;
    private final SentimentSource sentimentSource;
    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final Retry retry;

    public RetryingMarketDataClient(
            BarSource barSource,
            PriceSource priceSource,
            FundingRateSource fundingRateSource,
            SentimentSource sentimentSource,
            int maxAttempts,
            long baseDelayMs,
            long maxDelayMs) {
        this.barSource = barSource;
        this.priceSource = priceSource;
        this.fundingRateSource = fundingRateSource;
        this.sentimentSource = sentimentSource;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = IntervalFunction.ofExponentialBackoff(Math.max(1, baseDelayMs), 2.0, Math.max(1, maxDelayMs));
        this.retry = Retry.of(
                "marketData",
                RetryConfig.custom()
                        .maxAttempts(this.maxAttempts)
                        .intervalFunction(backoff)
                        .retryExceptions(MarketDataException.class)
                        .build());
    }

    public Optional<List<Bar>> fetchBars(String symbol, int limit) {
        return withRetry("bars", symbol, () -> barSource.fetchBars(symbol, limit));
    }

    public Optional<BigDecimal> fetchPrice(String symbol) {
        return withRetry("price", symbol, () -> priceSource.fetchPrice(symbol));
    }

    public Optional<BigDecimal> fetchFundingRate(String symbol) {
        if (fundingRateSource == null) {
            return Optional.empty();
        }
        return withRetry("funding", symbol, () -> fundingRateSource.fetchFundingRate(symbol).orElse(null));
    }

    public Optional<SentimentSignal> fetchSentiment(String symbol) {
        if (sentimentSource == null) {
            return Optional.empty();
        }
        return withRetry("sentiment", symbol, () -> sentimentSource.fetchSentiment(symbol).orElse(null));
    }

    /** Delay before the attempt following {@code attempt} (1-based). */
    public long backoffMs(int attempt) {
        return backoff.apply(attempt);
    }

    private <T> Optional<T> withRetry(String what, String symbol, Supplier<T> call) {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<T> logged = () -> {
            int attempt = attempts.incrementAndGet();
            try {
                return call.get();
            } catch (MarketDataException e) {
                log.warn("Fetch {} for {} attempt {}/{} failed: {}", what, symbol, attempt, maxAttempts, e.getMessage());
                throw e;
            }
        };
        try {
            return Optional.ofNullable(Retry.decorateSupplier(retry, logged).get());
        } catch (MarketDataException e) {
            log.warn("Skipping {} this tick: {} fetch failed after {} attempts", symbol, what, attempts.get());
            return Optional.empty();
        }
    }
}
