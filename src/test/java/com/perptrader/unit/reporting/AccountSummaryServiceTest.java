package com.perptrader.unit.reporting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.exception.ResourceNotFoundException;
import com.perptrader.ledger.InMemoryLedgerRepository;
import com.perptrader.reporting.AccountSummary;
import com.perptrader.reporting.AccountSummaryService;
import com.perptrader.simulator.AccountDefaults;
import com.perptrader.simulator.EngineSettings;
import com.perptrader.simulator.OpenRequest;
import com.perptrader.simulator.SimulationEngine;
import com.perptrader.simulator.Sizing;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountSummaryServiceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private SimulationEngine engine;
    private AccountSummaryService service;

    @BeforeEach
    void setUp() {
        engine = new SimulationEngine(
                new InMemoryLedgerRepository(),
                EngineSettings.builder().build(),
                AccountDefaults.builder().build());
        engine.getOrCreateAccount("paper", new BigDecimal("10000"), T0);
        service = new AccountSummaryService(engine);
    }

    @Test
    void flatAccount_equalsStartingEquity() {
        AccountSummary summary = service.getSummary("paper");

        assertThat(summary.getEquity()).isEqualByComparingTo("10000");
        assertThat(summary.getNetPnl()).isEqualByComparingTo("0");
        assertThat(summary.getWinRate()).isEqualByComparingTo("0");
        assertThat(summary.getOpenPositions()).isEmpty();
    }

    @Test
    void openPosition_valuedAtRecordedMark() {
        openLong();
        service.recordMarks("paper", Map.of("BTCUSDT", new BigDecimal("104")));

        AccountSummary summary = service.getSummary("paper");

        // 20 * (104 - 100.10) = 78 unrealized on 1001 locked margin
        assertThat(summary.getBalance()).isEqualByComparingTo("8998.00");
        assertThat(summary.getLockedMargin()).isEqualByComparingTo("1001.00");
        assertThat(summary.getUnrealizedPnl()).isEqualByComparingTo("78.00");
        assertThat(summary.getEquity()).isEqualByComparingTo("10077.00");
        assertThat(summary.getOpenPositions()).hasSize(1);
    }

    @Test
    void missingMark_countsPositionAsFlat() {
        openLong();
        service.recordMarks("paper", Map.of("BTCUSDT", new BigDecimal("104")));
        service.clearMarks("paper");

        AccountSummary summary = service.getSummary("paper");

        assertThat(summary.getUnrealizedPnl()).isEqualByComparingTo("0");
        assertThat(summary.getEquity()).isEqualByComparingTo("9999.00");
    }

    @Test
    void unknownAccount_notFound() {
        assertThatThrownBy(() -> service.getSummary("ghost"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    private void openLong() {
        engine.open(OpenRequest.builder()
                .accountName("paper")
                .symbol("BTCUSDT")
                .side(PositionSide.LONG)
                .sizing(Sizing.notional(new BigDecimal("2000")))
                .leverage(2)
                .referencePrice(new BigDecimal("100"))
                .timestamp(T0)
                .build());
    }
}
