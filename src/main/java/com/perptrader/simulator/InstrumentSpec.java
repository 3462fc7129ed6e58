package com.perptrader.simulator;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InstrumentSpec {

    BigDecimal tickSize;
    BigDecimal quantityStep;
}
