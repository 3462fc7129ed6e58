package com.perptrader.marketdata;

import com.perptrader.domain.model.Bar;
import com.perptrader.exception.MarketDataException;
import java.util.List;

/** Ordered OHLCV bars per symbol at a fixed granularity. */
public interface BarSource {

    /**
     * Returns up to {@code limit} of the most recent closed bars, oldest first.
     *
     * @throws MarketDataException on a transient failure; callers may retry
     */
    List<Bar> fetchBars(String symbol, int limit);
}
