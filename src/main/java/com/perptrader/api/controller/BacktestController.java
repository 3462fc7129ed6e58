package com.perptrader.api.controller;

import com.perptrader.api.dto.request.BacktestRequest;
import com.perptrader.backtest.BacktestResult;
import com.perptrader.backtest.BacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs a backtest synchronously over a CSV file from the configured data directory.
 * Backtests use a private in-memory ledger and never touch persisted accounts.
 */
@RestController
@RequestMapping("/api/backtests")
@RequiredArgsConstructor
public class BacktestController {

    private final BacktestService backtestService;

    @PostMapping
    public ResponseEntity<BacktestResult> run(@Valid @RequestBody BacktestRequest request) {
        return ResponseEntity.ok(backtestService.run(request));
    }
}
