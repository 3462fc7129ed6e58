package com.perptrader.simulator;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Execution parameters of a SimulationEngine instance. Fee rates live on the Account;
 * everything that describes the simulated venue lives here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EngineSettings {

    /** Slippage as a fraction of the reference price (0.001 = 0.1%), applied against the trader. */
    @Builder.Default
    private BigDecimal slippageRate = new BigDecimal("0.001");

    @Builder.Default
    private int maxLeverage = 20;

    @Builder.Default
    private BigDecimal defaultTickSize = new BigDecimal("0.01");

    @Builder.Default
    private BigDecimal defaultQuantityStep = new BigDecimal("0.0001");

    /** Per-symbol overrides of tick size and quantity step. */
    @Builder.Default
    private Map<String, InstrumentSpec> instruments = new HashMap<>();

    public InstrumentSpec instrumentFor(String symbol) {
        InstrumentSpec spec = instruments.get(symbol);
        if (spec != null) {
            return spec;
        }
        return InstrumentSpec.builder()
                .tickSize(defaultTickSize)
                .quantityStep(defaultQuantityStep)
                .build();
    }
}
