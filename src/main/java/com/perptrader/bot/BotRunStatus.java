package com.perptrader.bot;

import com.perptrader.domain.enums.RunState;
import com.perptrader.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BotRunStatus {

    String runId;
    String accountName;
    List<String> symbols;
    StrategyType strategyType;
    String strategyId;
    RunState state;
    String stopReason;
    Instant startedAt;
    Instant stoppedAt;
    BigDecimal startingEquity;
    SessionStats.Snapshot stats;
}
