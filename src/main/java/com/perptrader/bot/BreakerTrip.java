package com.perptrader.bot;

import com.perptrader.domain.enums.RunState;
import lombok.Value;

/** A tripped circuit breaker: the terminal state it leads to and why. */
@Value
public class BreakerTrip {

    RunState state;
    String reason;
}
