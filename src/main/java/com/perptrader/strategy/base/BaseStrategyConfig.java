package com.perptrader.strategy.base;

import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration shared by every strategy family.
 *
 * <p>Family configs extend this with their own named, range-checked fields. Field
 * constraints are checked by Bean Validation when the StrategyFactory binds options;
 * {@link #validate()} adds the cross-field rules annotations cannot express.
 *
 * <p>Uses {@code @SuperBuilder} so tests and callers can chain base and family fields:
 * {@code BreakoutConfig.builder().cooldownSeconds(60).lookback(30).build()}.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public class BaseStrategyConfig {

    /** Minimum confidence (0-10) for an OPEN decision to be acted on. */
    @DecimalMin("0.0")
    @DecimalMax("10.0")
    @Builder.Default
    private double minConfidence = 3.0;

    /** Seconds after a close during which the same symbol is not re-entered. */
    @PositiveOrZero
    @Builder.Default
    private long cooldownSeconds = 120;

    /** Positions older than this are closed. Null disables the holding-time exit. */
    @Positive
    private Long maxHoldingSeconds;

    /**
     * Sentiment confidence (0-1) at or above which an opposing sentiment score vetoes an
     * entry. Null disables the veto.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double sentimentVetoConfidence;

    /**
     * Cross-field checks. Subclasses override and call super.
     *
     * @throws BusinessException with VALIDATION_ERROR when the combination is invalid
     */
    public void validate() {
        // no cross-field rules at this level
    }

    protected static void require(boolean condition, String message) {
        if (!condition) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, message);
        }
    }
}
