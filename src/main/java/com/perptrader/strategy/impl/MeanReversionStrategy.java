package com.perptrader.strategy.impl;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.StrategyType;
import com.perptrader.domain.model.Bar;
import com.perptrader.domain.model.Position;
import com.perptrader.indicator.BarSeriesAdapter;
import com.perptrader.strategy.base.BaseStrategy;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.MarketSnapshot;
import java.math.BigDecimal;
import java.util.List;
import org.ta4j.core.BarSeries;

/**
 * Oscillator mean-reversion strategy: fades an impulse that fails to follow through while
 * the oscillator is stretched.
 *
 * <p><b>Entry:</b> an up-impulse of at least {@code impulseThresholdPercent} over
 * {@code impulseLookback} bars, RSI above {@code overbought}, and a last bar that closes
 * against the impulse opens a SHORT. The mirror image opens a LONG. Protective stop and
 * target are ATR multiples.
 *
 * <p><b>Exit:</b> unrealized PnL reaching {@code profitTarget} or {@code -lossLimit}, or the
 * holding limit.
 */
public class MeanReversionStrategy extends BaseStrategy {

    static final long DEFAULT_MAX_HOLDING_SECONDS = 1800;

    private final MeanReversionConfig reversionConfig;

    public MeanReversionStrategy(String id, String name, MeanReversionConfig config) {
        super(id, name, config);
        this.reversionConfig = config;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MEAN_REVERSION;
    }

    @Override
    public int getMinimumBarsRequired() {
        int indicators = Math.max(reversionConfig.getRsiPeriod(), reversionConfig.getAtrPeriod()) + 1;
        return Math.max(indicators, reversionConfig.getImpulseLookback() + 2);
    }

    @Override
    protected Long maxHoldingSeconds() {
        Long configured = super.maxHoldingSeconds();
        return configured != null ? configured : DEFAULT_MAX_HOLDING_SECONDS;
    }

    @Override
    protected Decision evaluateEntry(MarketSnapshot snapshot) {
        List<Bar> bars = snapshot.getBars();
        int last = bars.size() - 1;
        double close = bars.get(last).getClose().doubleValue();
        double previous = bars.get(last - 1).getClose().doubleValue();
        double origin = bars.get(last - 1 - reversionConfig.getImpulseLookback()).getClose().doubleValue();
        double impulse = (previous - origin) / origin * 100;

        if (Math.abs(impulse) < reversionConfig.getImpulseThresholdPercent()) {
            return Decision.hold();
        }

        BarSeries series = BarSeriesAdapter.toSeries(snapshot.getSymbol(), bars);
        double rsi = BarSeriesAdapter.lastRsi(series, reversionConfig.getRsiPeriod());
        double atr = BarSeriesAdapter.lastAtr(series, reversionConfig.getAtrPeriod());

        boolean upImpulseFailed = impulse > 0 && close < previous;
        boolean downImpulseFailed = impulse < 0 && close > previous;

        if (upImpulseFailed && rsi > reversionConfig.getOverbought()) {
            double stretch = (rsi - reversionConfig.getOverbought()) / (100 - reversionConfig.getOverbought());
            return entry(PositionSide.SHORT, close, atr, confidence(impulse, stretch), impulse, rsi);
        }
        if (downImpulseFailed && rsi < reversionConfig.getOversold()) {
            double stretch = (reversionConfig.getOversold() - rsi) / reversionConfig.getOversold();
            return entry(PositionSide.LONG, close, atr, confidence(impulse, stretch), impulse, rsi);
        }
        return Decision.hold();
    }

    @Override
    protected Decision evaluateExit(MarketSnapshot snapshot, Position position) {
        BigDecimal pnl = unrealizedPnl(position, snapshot.lastBar().getClose());
        if (pnl.compareTo(reversionConfig.getProfitTarget()) >= 0) {
            return Decision.close("profit target " + reversionConfig.getProfitTarget() + " reached");
        }
        if (pnl.compareTo(reversionConfig.getLossLimit().negate()) <= 0) {
            return Decision.close("loss limit " + reversionConfig.getLossLimit() + " reached");
        }
        return Decision.hold();
    }

    private Decision entry(PositionSide side, double close, double atr, double confidence, double impulse, double rsi) {
        double stopDistance = atr * reversionConfig.getAtrStopMultiplier();
        double targetDistance = atr * reversionConfig.getAtrTargetMultiplier();
        double stop = side == PositionSide.LONG ? close - stopDistance : close + stopDistance;
        double target = side == PositionSide.LONG ? close + targetDistance : close - targetDistance;
        String reason = String.format("failed %.2f%% impulse, RSI %.1f", impulse, rsi);
        return Decision.open(side, confidence, price(stop), price(target), null, reason);
    }

    /** 0-10: base 3, impulse size up to 3, oscillator stretch up to 4. */
    private double confidence(double impulse, double stretch) {
        double score = 3.0;
        score += Math.min(3.0, Math.abs(impulse) / reversionConfig.getImpulseThresholdPercent());
        score += Math.min(4.0, Math.max(0, stretch * 4.0));
        return Math.min(10.0, score);
    }
}
