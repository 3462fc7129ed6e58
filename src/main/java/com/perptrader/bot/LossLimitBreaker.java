package com.perptrader.bot;

import com.perptrader.domain.enums.RunState;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Trips when realized plus unrealized loss since run start reaches {@code -|limit|}.
 */
public class LossLimitBreaker implements RunBreaker {

    private final BigDecimal floor;

    public LossLimitBreaker(BigDecimal limit) {
        this.floor = limit.abs().negate();
    }

    @Override
    public Optional<BreakerTrip> check(Instant now, BigDecimal equityChange) {
        if (equityChange.compareTo(floor) > 0) {
            return Optional.empty();
        }
        return Optional.of(new BreakerTrip(
                RunState.STOPPED_BY_LOSS_LIMIT,
                "loss " + equityChange.setScale(2, RoundingMode.HALF_UP) + " reached floor " + floor));
    }
}
