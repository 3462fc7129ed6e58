package com.perptrader.backtest;

import com.perptrader.domain.model.Trade;
import com.perptrader.reporting.EquityPoint;
import com.perptrader.reporting.PerformanceReport;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BacktestResult {

    private String strategyId;
    private String strategyName;
    private String symbol;
    private int barsProcessed;
    private int warmupBars;
    private Instant startTime;
    private Instant endTime;
    private BigDecimal startingEquity;
    private BigDecimal finalBalance;
    private int rejectedOpens;
    private PerformanceReport report;
    private List<EquityPoint> equityCurve;
    private List<Trade> trades;
}
