package com.perptrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One fixed-interval OHLCV record. {@code timestamp} is the bar's close time.
 */
@Value
@Builder
public class Bar {

    Instant timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
}
