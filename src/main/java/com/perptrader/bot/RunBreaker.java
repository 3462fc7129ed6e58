package com.perptrader.bot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Circuit breaker evaluated at the end of every tick. Tripping is a termination path, not
 * an error: the run stops in the returned state and emits its final summary.
 */
public interface RunBreaker {

    /**
     * @param now          tick time
     * @param equityChange current equity minus equity at run start
     */
    Optional<BreakerTrip> check(Instant now, BigDecimal equityChange);
}
