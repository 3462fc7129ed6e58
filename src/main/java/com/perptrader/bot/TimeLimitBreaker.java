package com.perptrader.bot;

import com.perptrader.domain.enums.RunState;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** Trips once the run has been active for {@code limit}. */
public class TimeLimitBreaker implements RunBreaker {

    private final Instant startedAt;
    private final Duration limit;

    public TimeLimitBreaker(Instant startedAt, Duration limit) {
        this.startedAt = startedAt;
        this.limit = limit;
    }

    @Override
    public Optional<BreakerTrip> check(Instant now, BigDecimal equityChange) {
        Duration elapsed = Duration.between(startedAt, now);
        if (elapsed.compareTo(limit) < 0) {
            return Optional.empty();
        }
        return Optional.of(new BreakerTrip(
                RunState.STOPPED_BY_TIME_LIMIT,
                "time limit " + limit + " reached after " + elapsed.toSeconds() + "s"));
    }
}
