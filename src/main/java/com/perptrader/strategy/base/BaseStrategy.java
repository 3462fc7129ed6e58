package com.perptrader.strategy.base;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.SentimentSignal;
import com.perptrader.domain.model.Trade;
import com.perptrader.simulator.LedgerMath;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for all strategy families.
 *
 * <p>Provides the guards every family shares, in evaluation order:
 * <ul>
 *   <li><b>History guard:</b> HOLD until {@link #getMinimumBarsRequired()} bars exist</li>
 *   <li><b>Holding-time exit:</b> CLOSE once a position outlives {@link #maxHoldingSeconds()}</li>
 *   <li><b>Cooldown:</b> HOLD on a symbol for {@code cooldownSeconds} after a close</li>
 *   <li><b>Confidence filter:</b> OPEN decisions below {@code minConfidence} become HOLD</li>
 *   <li><b>Sentiment veto:</b> a confident opposing sentiment turns an OPEN into HOLD</li>
 * </ul>
 *
 * <p>Subclasses implement {@link #evaluateEntry} (no open position) and
 * {@link #evaluateExit} (position open). Both must be side-effect free with respect to the
 * ledger; cooldown bookkeeping is the only state kept here.
 *
 * <p>Time comes from {@link MarketSnapshot#getTimestamp()}, never from the wall clock, so
 * cooldowns and holding limits replay identically in backtests.
 */
public abstract class BaseStrategy implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(BaseStrategy.class);

    // ---- Identity ----
    protected final String id;
    protected final String name;
    protected final BaseStrategyConfig config;

    // ---- State ----
    private final Map<String, Instant> lastCloseBySymbol = new ConcurrentHashMap<>();

    protected BaseStrategy(String id, String name, BaseStrategyConfig config) {
        config.validate();
        this.id = id;
        this.name = name;
        this.config = config;
    }

    // ========================
    // ABSTRACT METHODS (each family implements these)
    // ========================

    /** Called when the symbol is flat and not cooling down. Returns OPEN or HOLD. */
    protected abstract Decision evaluateEntry(MarketSnapshot snapshot);

    /** Called while a position is open. Returns CLOSE or HOLD. */
    protected abstract Decision evaluateExit(MarketSnapshot snapshot, Position position);

    // ========================
    // EVALUATION
    // ========================

    @Override
    public final Decision evaluate(MarketSnapshot snapshot, Optional<Position> openPosition) {
        if (snapshot.barCount() < getMinimumBarsRequired()) {
            return Decision.hold("insufficient history: " + snapshot.barCount() + "/" + getMinimumBarsRequired());
        }

        if (openPosition.isPresent()) {
            Position position = openPosition.get();
            if (holdingExpired(position, snapshot.getTimestamp())) {
                return Decision.close("max holding time of " + maxHoldingSeconds() + "s reached");
            }
            Decision exit = evaluateExit(snapshot, position);
            return exit.isOpen() ? Decision.hold("already positioned") : exit;
        }

        if (isInCooldown(snapshot.getSymbol(), snapshot.getTimestamp())) {
            return Decision.hold("cooldown");
        }

        Decision entry = evaluateEntry(snapshot);
        if (!entry.isOpen()) {
            return entry.isClose() ? Decision.hold("flat") : entry;
        }
        if (entry.getConfidence() < config.getMinConfidence()) {
            log.debug(
                    "[{}] {} {} confidence {} below minimum {}",
                    name,
                    snapshot.getSymbol(),
                    entry.getSide(),
                    entry.getConfidence(),
                    config.getMinConfidence());
            return Decision.hold("confidence below minimum");
        }
        if (sentimentVetoes(entry.getSide(), snapshot.getSentiment())) {
            log.debug("[{}] {} {} vetoed by sentiment", name, snapshot.getSymbol(), entry.getSide());
            return Decision.hold("sentiment veto");
        }
        return entry;
    }

    @Override
    public void onPositionClosed(Trade trade) {
        lastCloseBySymbol.put(trade.getSymbol(), trade.getClosedAt());
    }

    public boolean isInCooldown(String symbol, Instant now) {
        Instant lastClose = lastCloseBySymbol.get(symbol);
        if (lastClose == null || config.getCooldownSeconds() <= 0) {
            return false;
        }
        return Duration.between(lastClose, now).getSeconds() < config.getCooldownSeconds();
    }

    /** Holding limit in seconds, or null for none. Families may supply a default. */
    protected Long maxHoldingSeconds() {
        return config.getMaxHoldingSeconds();
    }

    private boolean holdingExpired(Position position, Instant now) {
        Long limit = maxHoldingSeconds();
        if (limit == null || position.getOpenedAt() == null) {
            return false;
        }
        return Duration.between(position.getOpenedAt(), now).getSeconds() >= limit;
    }

    private boolean sentimentVetoes(PositionSide side, SentimentSignal sentiment) {
        Double threshold = config.getSentimentVetoConfidence();
        if (threshold == null || sentiment == null || sentiment.getConfidence() < threshold) {
            return false;
        }
        return side == PositionSide.LONG ? sentiment.getScore() < 0 : sentiment.getScore() > 0;
    }

    // ========================
    // HELPERS FOR SUBCLASSES
    // ========================

    /** Signed price move since entry, in percent (positive = in profit). */
    protected static double movePercent(Position position, BigDecimal price) {
        BigDecimal move = LedgerMath.percentOf(price.subtract(position.getEntryPrice()), position.getEntryPrice());
        return move.multiply(position.getSide().sign()).doubleValue();
    }

    /** Unrealized PnL in quote currency at {@code price}, before exit costs. */
    protected static BigDecimal unrealizedPnl(Position position, BigDecimal price) {
        return price.subtract(position.getEntryPrice())
                .multiply(position.getSize())
                .multiply(position.getSide().sign());
    }

    protected static BigDecimal price(double value) {
        return BigDecimal.valueOf(value).setScale(LedgerMath.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    // ========================
    // IDENTITY
    // ========================

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    public BaseStrategyConfig getConfig() {
        return config;
    }
}
