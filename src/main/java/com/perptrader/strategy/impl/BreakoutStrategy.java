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
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;

/**
 * Threshold-breakout strategy: trades a close beyond a rolling support/resistance band.
 *
 * <p><b>Entry (long):</b> the close is at least {@code breakoutThresholdPercent} above the
 * nearest resistance below it, price was under that level within the last
 * {@code confirmationBars} bars, volume confirms, and RSI is below {@code rsiLongCeiling}.
 * Shorts mirror this on support. Stop is ATR-based (at least {@code minStopPercent} away),
 * the target sits at {@code riskRewardRatio} times the risk, and a trailing stop follows
 * when configured.
 *
 * <p><b>Exit:</b> momentum exhaustion (RSI beyond the exit band while sufficiently in
 * profit) or range contraction (ATR as percent of price below {@code minAtrPercent}).
 * Protective stops are handled by the engine.
 */
public class BreakoutStrategy extends BaseStrategy {

    private static final Logger log = LoggerFactory.getLogger(BreakoutStrategy.class);

    private final BreakoutConfig breakoutConfig;

    public BreakoutStrategy(String id, String name, BreakoutConfig config) {
        super(id, name, config);
        this.breakoutConfig = config;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BREAKOUT;
    }

    @Override
    public int getMinimumBarsRequired() {
        BreakoutConfig c = breakoutConfig;
        int indicators = Math.max(c.getVolumePeriod(), Math.max(c.getRsiPeriod(), c.getAtrPeriod()) + 1);
        return Math.max(c.getLookback(), indicators) + 1;
    }

    @Override
    protected Decision evaluateEntry(MarketSnapshot snapshot) {
        List<Bar> bars = snapshot.getBars();
        int last = bars.size() - 1;
        double close = bars.get(last).getClose().doubleValue();
        List<Bar> range = bars.subList(last - breakoutConfig.getLookback(), last);

        OptionalDouble resistance = nearestLevelBelow(localHighs(range), close);
        OptionalDouble support = nearestLevelAbove(localLows(range), close);
        if (resistance.isEmpty() && support.isEmpty()) {
            return Decision.hold("no levels in range");
        }

        BarSeries series = BarSeriesAdapter.toSeries(snapshot.getSymbol(), bars);
        double volumeRatio = BarSeriesAdapter.volumeRatio(series, breakoutConfig.getVolumePeriod());
        if (volumeRatio < breakoutConfig.getMinVolumeRatio()) {
            return Decision.hold("volume not confirming");
        }
        double rsi = BarSeriesAdapter.lastRsi(series, breakoutConfig.getRsiPeriod());
        double atr = BarSeriesAdapter.lastAtr(series, breakoutConfig.getAtrPeriod());

        if (resistance.isPresent()) {
            double level = resistance.getAsDouble();
            double strength = (close - level) / level * 100;
            if (strength >= breakoutConfig.getBreakoutThresholdPercent()
                    && wasBelow(bars, level)
                    && rsi < breakoutConfig.getRsiLongCeiling()) {
                return entry(PositionSide.LONG, close, atr, confidence(strength, volumeRatio, rsi, true), level);
            }
        }
        if (support.isPresent()) {
            double level = support.getAsDouble();
            double strength = (level - close) / level * 100;
            if (strength >= breakoutConfig.getBreakoutThresholdPercent()
                    && wasAbove(bars, level)
                    && rsi > breakoutConfig.getRsiShortFloor()) {
                return entry(PositionSide.SHORT, close, atr, confidence(strength, volumeRatio, rsi, false), level);
            }
        }
        return Decision.hold();
    }

    @Override
    protected Decision evaluateExit(MarketSnapshot snapshot, Position position) {
        BarSeries series = BarSeriesAdapter.toSeries(snapshot.getSymbol(), snapshot.getBars());
        BigDecimal closePrice = snapshot.lastBar().getClose();
        double close = closePrice.doubleValue();
        double move = movePercent(position, closePrice);
        double rsi = BarSeriesAdapter.lastRsi(series, breakoutConfig.getRsiPeriod());

        if (move > breakoutConfig.getExitMinProfitPercent()) {
            if (position.getSide() == PositionSide.LONG && rsi > breakoutConfig.getExitRsiOverbought()) {
                return Decision.close(String.format("RSI overbought (%.1f) at +%.2f%%", rsi, move));
            }
            if (position.getSide() == PositionSide.SHORT && rsi < breakoutConfig.getExitRsiOversold()) {
                return Decision.close(String.format("RSI oversold (%.1f) at +%.2f%%", rsi, move));
            }
        }

        double atrPercent = BarSeriesAdapter.lastAtr(series, breakoutConfig.getAtrPeriod()) / close * 100;
        if (atrPercent < breakoutConfig.getMinAtrPercent()) {
            return Decision.close(String.format("range contracted (ATR %.3f%% of price)", atrPercent));
        }
        return Decision.hold();
    }

    private Decision entry(PositionSide side, double close, double atr, double confidence, double level) {
        double minDistance = close * breakoutConfig.getMinStopPercent() / 100;
        double distance = Math.max(atr * breakoutConfig.getAtrStopMultiplier(), minDistance);
        double stop = side == PositionSide.LONG ? close - distance : close + distance;
        double target = side == PositionSide.LONG
                ? close + distance * breakoutConfig.getRiskRewardRatio()
                : close - distance * breakoutConfig.getRiskRewardRatio();
        BigDecimal trailing = breakoutConfig.getTrailingStopPercent() == null
                ? null
                : BigDecimal.valueOf(breakoutConfig.getTrailingStopPercent()).movePointLeft(2);

        String reason = String.format("%s breakout through %.2f", side, level);
        log.debug("[{}] {} (confidence {})", name, reason, confidence);
        return Decision.open(side, confidence, price(stop), price(target), trailing, reason);
    }

    /** 0-10: breakout strength up to 4, volume surplus up to 3, RSI headroom up to 3. */
    private double confidence(double strength, double volumeRatio, double rsi, boolean isLong) {
        double score = Math.min(4.0, strength / breakoutConfig.getBreakoutThresholdPercent() * 1.5);
        score += Math.min(3.0, Math.max(0, (volumeRatio - 1.0) * 2.0));
        double headroom = isLong
                ? (breakoutConfig.getRsiLongCeiling() - rsi) / breakoutConfig.getRsiLongCeiling()
                : (rsi - breakoutConfig.getRsiShortFloor()) / (100 - breakoutConfig.getRsiShortFloor());
        score += Math.min(3.0, Math.max(0, headroom * 3.0));
        return Math.min(10.0, score);
    }

    private boolean wasBelow(List<Bar> bars, double level) {
        int last = bars.size() - 1;
        for (int i = Math.max(0, last - breakoutConfig.getConfirmationBars()); i < last; i++) {
            if (bars.get(i).getClose().doubleValue() < level) {
                return true;
            }
        }
        return false;
    }

    private boolean wasAbove(List<Bar> bars, double level) {
        int last = bars.size() - 1;
        for (int i = Math.max(0, last - breakoutConfig.getConfirmationBars()); i < last; i++) {
            if (bars.get(i).getClose().doubleValue() > level) {
                return true;
            }
        }
        return false;
    }

    private double[] localHighs(List<Bar> range) {
        int w = breakoutConfig.getExtremaWindow();
        return IntStream.range(w, range.size() - w)
                .filter(i -> {
                    double high = range.get(i).getHigh().doubleValue();
                    for (int j = i - w; j <= i + w; j++) {
                        if (range.get(j).getHigh().doubleValue() > high) {
                            return false;
                        }
                    }
                    return true;
                })
                .mapToDouble(i -> range.get(i).getHigh().doubleValue())
                .toArray();
    }

    private double[] localLows(List<Bar> range) {
        int w = breakoutConfig.getExtremaWindow();
        return IntStream.range(w, range.size() - w)
                .filter(i -> {
                    double low = range.get(i).getLow().doubleValue();
                    for (int j = i - w; j <= i + w; j++) {
                        if (range.get(j).getLow().doubleValue() < low) {
                            return false;
                        }
                    }
                    return true;
                })
                .mapToDouble(i -> range.get(i).getLow().doubleValue())
                .toArray();
    }

    private static OptionalDouble nearestLevelBelow(double[] levels, double price) {
        return Arrays.stream(levels).filter(l -> l < price).max();
    }

    private static OptionalDouble nearestLevelAbove(double[] levels, double price) {
        return Arrays.stream(levels).filter(l -> l > price).min();
    }
}
