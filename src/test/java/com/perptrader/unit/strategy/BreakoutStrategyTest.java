package com.perptrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.model.Bar;
import com.perptrader.exception.BusinessException;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.MarketSnapshot;
import com.perptrader.strategy.impl.BreakoutConfig;
import com.perptrader.strategy.impl.BreakoutStrategy;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BreakoutStrategy on a synthetic range: closes alternate between 100.0 and
 * 100.4 with a single swing high of 101 at bar 20, followed by a breakout bar.
 */
class BreakoutStrategyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private BreakoutStrategy strategy;

    @BeforeEach
    void setUp() {
        // RSI ceiling raised so the oscillating range does not block the long
        strategy = new BreakoutStrategy(
                "STR-BO", "breakout", BreakoutConfig.builder().rsiLongCeiling(80).build());
    }

    @Test
    void minimumBars_coversLookbackAndIndicators() {
        assertThat(strategy.getMinimumBarsRequired()).isEqualTo(31);
    }

    @Test
    void closeThroughResistanceOnVolume_opensLong() {
        List<Bar> bars = range();
        bars.add(bar(40, "101.8", "102", "100.3", "5000"));

        Decision decision = strategy.evaluate(snapshot(bars), Optional.empty());

        assertThat(decision.isOpen()).isTrue();
        assertThat(decision.getSide()).isEqualTo(PositionSide.LONG);
        assertThat(decision.getStopLoss()).isLessThan(new BigDecimal("101.8"));
        assertThat(decision.getTakeProfit()).isGreaterThan(new BigDecimal("101.8"));
        assertThat(decision.getTrailingStopPercent()).isEqualByComparingTo("0.015");
        assertThat(decision.getReason()).contains("101.00");
    }

    @Test
    void stopRespectsMinimumDistance() {
        List<Bar> bars = range();
        bars.add(bar(40, "101.8", "102", "100.3", "5000"));

        Decision decision = strategy.evaluate(snapshot(bars), Optional.empty());

        // ATR is well under 1, so the 2% floor sets the distance: 101.8 * 0.02 = 2.036
        assertThat(decision.getStopLoss()).isEqualByComparingTo("99.764");
        assertThat(decision.getTakeProfit()).isEqualByComparingTo("105.872");
    }

    @Test
    void breakoutWithoutVolume_holds() {
        List<Bar> bars = range();
        bars.add(bar(40, "101.8", "102", "100.3", "1000"));

        Decision decision = strategy.evaluate(snapshot(bars), Optional.empty());

        assertThat(decision.isHold()).isTrue();
        assertThat(decision.getReason()).isEqualTo("volume not confirming");
    }

    @Test
    void closeInsideRange_holds() {
        List<Bar> bars = range();
        bars.add(bar(40, "100.6", "100.8", "100.3", "5000"));

        assertThat(strategy.evaluate(snapshot(bars), Optional.empty()).isOpen()).isFalse();
    }

    @Test
    void shortHistory_holds() {
        List<Bar> bars = range().subList(0, 20);

        Decision decision = strategy.evaluate(snapshot(bars), Optional.empty());

        assertThat(decision.getReason()).isEqualTo("insufficient history: 20/31");
    }

    @Test
    void lookbackTooSmallForWindow_rejectedAtConstruction() {
        BreakoutConfig config = BreakoutConfig.builder().lookback(12).extremaWindow(6).build();

        assertThatThrownBy(() -> new BreakoutStrategy("STR-X", "bad", config))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("lookback");
    }

    private static List<Bar> range() {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            BigDecimal close = i % 2 == 0 ? new BigDecimal("100.0") : new BigDecimal("100.4");
            BigDecimal high = i == 20 ? new BigDecimal("101") : close.add(new BigDecimal("0.2"));
            bars.add(Bar.builder()
                    .timestamp(T0.plusSeconds(60L * i))
                    .open(close)
                    .high(high)
                    .low(close.subtract(new BigDecimal("0.2")))
                    .close(close)
                    .volume(new BigDecimal("1000"))
                    .build());
        }
        return bars;
    }

    private static Bar bar(int index, String close, String high, String low, String volume) {
        return Bar.builder()
                .timestamp(T0.plusSeconds(60L * index))
                .open(new BigDecimal("100.4"))
                .high(new BigDecimal(high))
                .low(new BigDecimal(low))
                .close(new BigDecimal(close))
                .volume(new BigDecimal(volume))
                .build();
    }

    private static MarketSnapshot snapshot(List<Bar> bars) {
        Bar last = bars.get(bars.size() - 1);
        return MarketSnapshot.builder()
                .symbol("BTCUSDT")
                .bars(bars)
                .lastPrice(last.getClose())
                .timestamp(last.getTimestamp())
                .build();
    }
}
