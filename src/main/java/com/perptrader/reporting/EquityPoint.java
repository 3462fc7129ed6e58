package com.perptrader.reporting;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Value;

/** Realized equity after a trade closed (or at the start of the series). */
@Value
public class EquityPoint {

    Instant timestamp;
    BigDecimal equity;
}
