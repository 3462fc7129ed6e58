package com.perptrader.api.controller;

import com.perptrader.api.dto.request.StartBotRequest;
import com.perptrader.bot.BotRunService;
import com.perptrader.bot.BotRunStatus;
import com.perptrader.domain.model.Trade;
import com.perptrader.exception.ResourceNotFoundException;
import com.perptrader.reporting.AccountSummary;
import com.perptrader.reporting.TradeFeedService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Live bot runs.
 *
 * <ul>
 *   <li>POST /api/bots - start a run (409 if the account already has one)</li>
 *   <li>POST /api/bots/{runId}/stop - request a graceful stop; positions stay open</li>
 *   <li>GET  /api/bots/{runId} - run status and session stats</li>
 *   <li>GET  /api/bots/{runId}/trades - closed-trade feed of the run</li>
 *   <li>GET  /api/bots/{runId}/summary - last summary the run emitted</li>
 *   <li>GET  /api/bots - all runs since startup</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/bots")
@RequiredArgsConstructor
public class BotController {

    private final BotRunService botRunService;
    private final TradeFeedService tradeFeedService;

    @PostMapping
    public ResponseEntity<BotRunStatus> start(@Valid @RequestBody StartBotRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(botRunService.start(request));
    }

    @PostMapping("/{runId}/stop")
    public ResponseEntity<BotRunStatus> stop(@PathVariable String runId) {
        return ResponseEntity.ok(botRunService.stop(runId));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<BotRunStatus> getStatus(@PathVariable String runId) {
        return ResponseEntity.ok(botRunService.getStatus(runId));
    }

    @GetMapping("/{runId}/trades")
    public ResponseEntity<List<Trade>> getTrades(@PathVariable String runId) {
        botRunService.getStatus(runId);
        return ResponseEntity.ok(tradeFeedService.recentTrades(runId));
    }

    /** 404 until the run has emitted its first summary. */
    @GetMapping("/{runId}/summary")
    public ResponseEntity<AccountSummary> getSummary(@PathVariable String runId) {
        botRunService.getStatus(runId);
        return tradeFeedService.latestSummary(runId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Run summary", runId));
    }

    @GetMapping
    public ResponseEntity<List<BotRunStatus>> listRuns() {
        return ResponseEntity.ok(botRunService.listRuns());
    }
}
