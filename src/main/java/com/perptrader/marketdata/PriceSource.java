package com.perptrader.marketdata;

import com.perptrader.exception.MarketDataException;
import java.math.BigDecimal;

/** Current price lookup. */
public interface PriceSource {

    /** @throws MarketDataException on a transient failure; callers may retry */
    BigDecimal fetchPrice(String symbol);
}
