package com.perptrader.bot;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved limits of one bot run. A null {@code timeLimit} or {@code maxLossLimit} disables
 * that breaker.
 */
@Value
@Builder(toBuilder = true)
public class BotRunConfig {

    String accountName;
    List<String> symbols;

    @Builder.Default
    int leverage = 2;

    /** Share of the free balance committed as margin per new position. */
    @Builder.Default
    BigDecimal positionSizePercent = new BigDecimal("10");

    @Builder.Default
    int maxOpenPositions = 3;

    @Builder.Default
    Duration checkInterval = Duration.ofSeconds(60);

    @Builder.Default
    Duration summaryInterval = Duration.ofSeconds(60);

    @Builder.Default
    int barWindow = 100;

    /** Deadline for the joined market-data fan-out of one tick. */
    @Builder.Default
    Duration fetchTimeout = Duration.ofSeconds(30);

    Duration timeLimit;

    /** Loss (positive amount) versus run-start equity at which the run stops. */
    BigDecimal maxLossLimit;
}
