package com.perptrader.simulator;

import com.perptrader.domain.enums.CloseReason;
import java.math.BigDecimal;
import lombok.Value;

/**
 * A fired protective exit and the reference price the close should use.
 */
@Value
public class RiskTrigger {

    CloseReason reason;
    BigDecimal exitPrice;
}
