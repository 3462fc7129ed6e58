package com.perptrader.indicator;

import com.perptrader.domain.model.Bar;
import java.time.ZoneOffset;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;

/**
 * Bridges domain bars to ta4j. Strategies hand in their bar window and read the latest
 * indicator values as doubles; indicator math itself stays in ta4j.
 *
 * <p>Bars must be strictly increasing in time; ta4j rejects a bar whose end time does not
 * advance.
 */
public final class BarSeriesAdapter {

    private BarSeriesAdapter() {}

    public static BarSeries toSeries(String name, List<Bar> bars) {
        BarSeries series = new BaseBarSeriesBuilder().withName(name).build();
        for (Bar bar : bars) {
            series.addBar(
                    bar.getTimestamp().atZone(ZoneOffset.UTC),
                    bar.getOpen(),
                    bar.getHigh(),
                    bar.getLow(),
                    bar.getClose(),
                    bar.getVolume());
        }
        return series;
    }

    public static double lastRsi(BarSeries series, int period) {
        RSIIndicator rsi = new RSIIndicator(new ClosePriceIndicator(series), period);
        return rsi.getValue(series.getEndIndex()).doubleValue();
    }

    public static double lastAtr(BarSeries series, int period) {
        ATRIndicator atr = new ATRIndicator(series, period);
        return atr.getValue(series.getEndIndex()).doubleValue();
    }

    /** Latest volume divided by its simple average over {@code period} bars; 1.0 when undefined. */
    public static double volumeRatio(BarSeries series, int period) {
        int end = series.getEndIndex();
        double average = new SMAIndicator(new VolumeIndicator(series), period)
                .getValue(end)
                .doubleValue();
        if (average <= 0) {
            return 1.0;
        }
        return series.getBar(end).getVolume().doubleValue() / average;
    }
}
