package com.perptrader.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.simulator.FillPriceCalculator;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FillPriceCalculatorTest {

    private static final BigDecimal TICK = new BigDecimal("0.01");

    private FillPriceCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new FillPriceCalculator(new BigDecimal("0.001"));
    }

    @Test
    void entry_slipsAgainstTheTrader() {
        assertThat(calculator.entryFill(PositionSide.LONG, new BigDecimal("100"), TICK)).isEqualByComparingTo("100.10");
        assertThat(calculator.entryFill(PositionSide.SHORT, new BigDecimal("100"), TICK)).isEqualByComparingTo("99.90");
    }

    @Test
    void exit_slipsAgainstTheTrader() {
        assertThat(calculator.exitFill(PositionSide.LONG, new BigDecimal("104"), TICK)).isEqualByComparingTo("103.90");
        assertThat(calculator.exitFill(PositionSide.SHORT, new BigDecimal("104"), TICK)).isEqualByComparingTo("104.10");
    }

    @Test
    void roundToTick_halfUp() {
        assertThat(FillPriceCalculator.roundToTick(new BigDecimal("103.896"), TICK)).isEqualByComparingTo("103.90");
        assertThat(FillPriceCalculator.roundToTick(new BigDecimal("42.125"), new BigDecimal("0.05")))
                .isEqualByComparingTo("42.15");
    }

    @Test
    void roundToTick_withoutTick_returnsPrice() {
        assertThat(FillPriceCalculator.roundToTick(new BigDecimal("1.23456"), null)).isEqualByComparingTo("1.23456");
    }

    @Test
    void roundDownToStep_neverRoundsUp() {
        assertThat(FillPriceCalculator.roundDownToStep(new BigDecimal("0.12349"), new BigDecimal("0.001")))
                .isEqualByComparingTo("0.123");
    }
}
