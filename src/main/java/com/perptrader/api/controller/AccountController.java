package com.perptrader.api.controller;

import com.perptrader.api.dto.request.ResetAccountRequest;
import com.perptrader.bot.BotRunService;
import com.perptrader.domain.model.Order;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.exception.ResourceNotFoundException;
import com.perptrader.reporting.AccountSummary;
import com.perptrader.reporting.AccountSummaryService;
import com.perptrader.simulator.SimulationEngine;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to paper accounts plus reset.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET  /api/accounts/{name}/summary - equity, PnL and open positions at the last marks</li>
 *   <li>GET  /api/accounts/{name}/trades - closed trades, oldest first</li>
 *   <li>GET  /api/accounts/{name}/positions - open positions</li>
 *   <li>GET  /api/accounts/{name}/orders - simulated fills</li>
 *   <li>POST /api/accounts/{name}/reset - wipe history and restore starting equity</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/accounts")
public class AccountController {

    private static final Logger log = LoggerFactory.getLogger(AccountController.class);

    private final SimulationEngine simulationEngine;
    private final AccountSummaryService accountSummaryService;
    private final BotRunService botRunService;

    public AccountController(
            SimulationEngine simulationEngine,
            AccountSummaryService accountSummaryService,
            BotRunService botRunService) {
        this.simulationEngine = simulationEngine;
        this.accountSummaryService = accountSummaryService;
        this.botRunService = botRunService;
    }

    @GetMapping("/{name}/summary")
    public ResponseEntity<AccountSummary> getSummary(@PathVariable String name) {
        return ResponseEntity.ok(accountSummaryService.getSummary(name));
    }

    @GetMapping("/{name}/trades")
    public ResponseEntity<List<Trade>> getTrades(@PathVariable String name) {
        requireAccount(name);
        return ResponseEntity.ok(simulationEngine.getTrades(name));
    }

    @GetMapping("/{name}/positions")
    public ResponseEntity<List<Position>> getPositions(@PathVariable String name) {
        requireAccount(name);
        return ResponseEntity.ok(simulationEngine.getOpenPositions(name));
    }

    @GetMapping("/{name}/orders")
    public ResponseEntity<List<Order>> getOrders(@PathVariable String name) {
        requireAccount(name);
        return ResponseEntity.ok(simulationEngine.getOrders(name));
    }

    /**
     * Refused with 409 while a run is active on the account or positions remain open.
     * An empty body keeps the current starting equity.
     */
    @PostMapping("/{name}/reset")
    public ResponseEntity<AccountSummary> reset(
            @PathVariable String name, @Valid @RequestBody(required = false) ResetAccountRequest request) {
        log.info("Reset requested for account {}", name);
        botRunService.resetAccount(name, request != null ? request.getStartingEquity() : null);
        return ResponseEntity.ok(accountSummaryService.getSummary(name));
    }

    private void requireAccount(String name) {
        if (simulationEngine.findAccount(name).isEmpty()) {
            throw new ResourceNotFoundException("Account", name);
        }
    }
}
