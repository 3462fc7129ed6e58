package com.perptrader.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.perptrader.api.controller.BotController;
import com.perptrader.bot.BotRunService;
import com.perptrader.bot.BotRunStatus;
import com.perptrader.config.ApiResponseAdvice;
import com.perptrader.domain.enums.RunState;
import com.perptrader.domain.enums.StrategyType;
import com.perptrader.domain.model.Trade;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.exception.GlobalExceptionHandler;
import com.perptrader.exception.ResourceNotFoundException;
import com.perptrader.reporting.TradeFeedService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the BotController.
 */
@ExtendWith(MockitoExtension.class)
class BotControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BotRunService botRunService;

    @Mock
    private TradeFeedService tradeFeedService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BotController(botRunService, tradeFeedService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/bots starts a run and returns 201 with its status")
    void startReturnsCreated() throws Exception {
        when(botRunService.start(any())).thenReturn(runStatus("RUN-1", RunState.RUNNING));

        mockMvc.perform(post("/api/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"accountName":"paper","symbols":["BTCUSDT"],"strategyType":"BREAKOUT",
                                 "timeLimit":"10h","maxLossLimit":500}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.runId").value("RUN-1"))
                .andExpect(jsonPath("$.data.state").value("RUNNING"));
    }

    @Test
    @DisplayName("POST /api/bots without symbols fails validation")
    void startWithoutSymbolsIsRejected() throws Exception {
        mockMvc.perform(post("/api/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountName\":\"paper\",\"symbols\":[],\"strategyType\":\"BREAKOUT\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.symbols").exists());

        verify(botRunService, never()).start(any());
    }

    @Test
    @DisplayName("Unknown strategy type lists the allowed values")
    void unknownStrategyType() throws Exception {
        mockMvc.perform(post("/api/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountName\":\"paper\",\"symbols\":[\"BTCUSDT\"],\"strategyType\":\"MARTINGALE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.allowed[0]").value("BREAKOUT"));
    }

    @Test
    @DisplayName("Second run on the same account is a 409")
    void secondRunConflict() throws Exception {
        when(botRunService.start(any())).thenThrow(new BusinessException(
                ErrorCode.RUN_ALREADY_ACTIVE, "Account paper already has an active run", Map.of("runId", "RUN-1")));

        mockMvc.perform(post("/api/bots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountName\":\"paper\",\"symbols\":[\"BTCUSDT\"],\"strategyType\":\"BREAKOUT\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("RUN_ALREADY_ACTIVE"))
                .andExpect(jsonPath("$.error.details.runId").value("RUN-1"))
                .andExpect(jsonPath("$.error.path").value("/api/bots"));
    }

    @Test
    @DisplayName("POST /api/bots/{runId}/stop returns the run status")
    void stopRun() throws Exception {
        when(botRunService.stop("RUN-1")).thenReturn(runStatus("RUN-1", RunState.STOPPED_BY_SIGNAL));

        mockMvc.perform(post("/api/bots/RUN-1/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("STOPPED_BY_SIGNAL"));
    }

    @Test
    @DisplayName("GET /api/bots/{runId} for an unknown run is a 404")
    void unknownRun() throws Exception {
        when(botRunService.getStatus("RUN-X")).thenThrow(new ResourceNotFoundException("Bot run", "RUN-X"));

        mockMvc.perform(get("/api/bots/RUN-X"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.message").value("Bot run not found: RUN-X"));
    }

    @Test
    @DisplayName("GET /api/bots/{runId}/trades returns the closed-trade feed")
    void tradeFeed() throws Exception {
        when(botRunService.getStatus("RUN-1")).thenReturn(runStatus("RUN-1", RunState.RUNNING));
        Instant closedAt = Instant.parse("2024-01-01T01:00:00Z");
        when(tradeFeedService.recentTrades("RUN-1")).thenReturn(List.of(Trade.builder()
                .id("TRD-1")
                .symbol("BTCUSDT")
                .netPnl(new BigDecimal("73.96"))
                .entryFee(new BigDecimal("1.001"))
                .exitFee(new BigDecimal("1.039"))
                .openedAt(closedAt.minusSeconds(3600))
                .closedAt(closedAt)
                .build()));

        mockMvc.perform(get("/api/bots/RUN-1/trades"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].id").value("TRD-1"))
                .andExpect(jsonPath("$.data[0].win").value(true));
    }

    @Test
    @DisplayName("GET /api/bots/{runId}/summary is a 404 before the first summary")
    void summaryNotYetAvailable() throws Exception {
        when(botRunService.getStatus("RUN-1")).thenReturn(runStatus("RUN-1", RunState.RUNNING));
        when(tradeFeedService.latestSummary("RUN-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/bots/RUN-1/summary"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /api/bots lists all runs")
    void listRuns() throws Exception {
        when(botRunService.listRuns()).thenReturn(List.of(
                runStatus("RUN-1", RunState.STOPPED_BY_LOSS_LIMIT), runStatus("RUN-2", RunState.RUNNING)));

        mockMvc.perform(get("/api/bots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].state").value("STOPPED_BY_LOSS_LIMIT"));
    }

    private static BotRunStatus runStatus(String runId, RunState state) {
        return BotRunStatus.builder()
                .runId(runId)
                .accountName("paper")
                .symbols(List.of("BTCUSDT"))
                .strategyType(StrategyType.BREAKOUT)
                .state(state)
                .build();
    }
}
