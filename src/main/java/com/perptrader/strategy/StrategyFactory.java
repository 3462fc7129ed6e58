package com.perptrader.strategy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perptrader.domain.enums.StrategyType;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.strategy.base.BaseStrategy;
import com.perptrader.strategy.base.BaseStrategyConfig;
import com.perptrader.strategy.impl.BreakoutConfig;
import com.perptrader.strategy.impl.BreakoutStrategy;
import com.perptrader.strategy.impl.FundingCarryConfig;
import com.perptrader.strategy.impl.FundingCarryStrategy;
import com.perptrader.strategy.impl.MeanReversionConfig;
import com.perptrader.strategy.impl.MeanReversionStrategy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates strategy instances from a type plus either a typed config or a loose options map.
 *
 * <p>Options maps (from REST requests and bot configuration) are bound to the family's
 * config class with a strict ObjectMapper, so misspelled keys fail instead of silently
 * falling back to defaults. Bound configs then go through Bean Validation and the
 * config's own cross-field {@code validate()}.
 *
 * <p><b>Adding a new strategy family:</b>
 * <ol>
 *   <li>Create the config class extending {@link BaseStrategyConfig}</li>
 *   <li>Create the strategy class extending {@link BaseStrategy}</li>
 *   <li>Add the type to {@link StrategyType} and a case to {@link #configClassFor} and
 *       {@link #instantiate}</li>
 * </ol>
 *
 * <p>Strategy instances are plain Java objects, not Spring beans. Each bot run and each
 * backtest gets its own instance so cooldown state is never shared.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    private final ObjectMapper optionsMapper;
    private final Validator validator;

    public StrategyFactory(Validator validator) {
        this.validator = validator;
        this.optionsMapper = new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    /**
     * Binds {@code options} to the family's config class and creates the strategy.
     *
     * @param options family parameters by field name; null or empty means all defaults
     * @throws BusinessException VALIDATION_ERROR when an option is unknown, has the wrong
     *     type or violates a constraint
     */
    public BaseStrategy create(StrategyType type, String name, Map<String, Object> options) {
        return create(type, name, bindOptions(type, options));
    }

    /** Validates {@code config} and creates the strategy with a generated id. */
    public BaseStrategy create(StrategyType type, String name, BaseStrategyConfig config) {
        validateConstraints(config);
        String id = generateId();
        BaseStrategy strategy = instantiate(type, id, name, config);
        log.info("Created strategy: id={}, type={}, name={}", id, type, name);
        return strategy;
    }

    BaseStrategyConfig bindOptions(StrategyType type, Map<String, Object> options) {
        Map<String, Object> source = options == null ? Map.of() : options;
        try {
            return optionsMapper.convertValue(source, configClassFor(type));
        } catch (IllegalArgumentException e) {
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Invalid options for " + type + ": " + firstLine(reason),
                    Map.of("strategyType", type.name()));
        }
    }

    private void validateConstraints(BaseStrategyConfig config) {
        Set<ConstraintViolation<BaseStrategyConfig>> violations = validator.validate(config);
        if (violations.isEmpty()) {
            return;
        }
        Map<String, Object> fieldErrors = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> fieldErrors.put(v.getPropertyPath().toString(), v.getMessage()));
        throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Invalid strategy configuration", fieldErrors);
    }

    private Class<? extends BaseStrategyConfig> configClassFor(StrategyType type) {
        return switch (type) {
            case BREAKOUT -> BreakoutConfig.class;
            case MEAN_REVERSION -> MeanReversionConfig.class;
            case FUNDING_CARRY -> FundingCarryConfig.class;
        };
    }

    private BaseStrategy instantiate(StrategyType type, String id, String name, BaseStrategyConfig config) {
        return switch (type) {
            case BREAKOUT -> new BreakoutStrategy(id, name, asConfig(config, BreakoutConfig.class));
            case MEAN_REVERSION -> new MeanReversionStrategy(id, name, asConfig(config, MeanReversionConfig.class));
            case FUNDING_CARRY -> new FundingCarryStrategy(id, name, asConfig(config, FundingCarryConfig.class));
        };
    }

    /** Fails fast with a clear message if the wrong config type is passed. */
    private <T extends BaseStrategyConfig> T asConfig(BaseStrategyConfig config, Class<T> expectedType) {
        if (!expectedType.isInstance(config)) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Expected config type " + expectedType.getSimpleName() + " but got "
                            + config.getClass().getSimpleName());
        }
        return expectedType.cast(config);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unreadable options";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    /** Format: STR-A1B2C3D4 */
    String generateId() {
        return "STR-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
