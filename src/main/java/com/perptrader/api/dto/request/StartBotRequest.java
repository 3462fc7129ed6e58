package com.perptrader.api.dto.request;

import com.perptrader.domain.enums.StrategyType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Starts a bot run. Omitted limits fall back to the {@code perptrader.bot.*} defaults.
 * Durations accept "10h", "30min", "5m", "45s", "1d" or plain seconds.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StartBotRequest {

    @NotBlank
    private String accountName;

    @NotEmpty
    private List<@NotBlank String> symbols;

    @NotNull
    private StrategyType strategyType;

    private String strategyName;

    private Map<String, Object> strategyOptions;

    /** Used only when the account does not exist yet. */
    @Positive
    private BigDecimal startingEquity;

    @Min(1)
    @Max(125)
    private Integer leverage;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private BigDecimal positionSizePercent;

    @Min(1)
    private Integer maxOpenPositions;

    private String checkInterval;

    private String summaryInterval;

    private String timeLimit;

    /** Stop once equity has fallen this much below the run-start equity. */
    @Positive
    private BigDecimal maxLossLimit;
}
