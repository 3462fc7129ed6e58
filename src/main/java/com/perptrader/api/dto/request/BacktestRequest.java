package com.perptrader.api.dto.request;

import com.perptrader.domain.enums.StrategyType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Runs a strategy over a CSV bar file. File names are resolved inside the configured
 * backtest data directory.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    @NotBlank
    private String symbol;

    /** OHLCV file, e.g. "BTCUSDT_1h.csv". */
    @NotBlank
    private String csvFile;

    /** Optional {@code timestamp,rate} file for carry strategies. */
    private String fundingCsvFile;

    @NotNull
    private StrategyType strategyType;

    private String strategyName;

    /** Family parameters by name; omitted keys keep their defaults. */
    private Map<String, Object> strategyOptions;

    @Positive
    private BigDecimal startingEquity;

    @Min(1)
    @Max(125)
    private Integer leverage;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private BigDecimal positionSizePercent;

    @Min(1)
    private Integer warmupBars;

    @Min(2)
    private Integer barWindow;
}
