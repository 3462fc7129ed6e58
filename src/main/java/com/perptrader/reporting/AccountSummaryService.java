package com.perptrader.reporting;

import com.perptrader.domain.model.Account;
import com.perptrader.domain.model.Position;
import com.perptrader.exception.ResourceNotFoundException;
import com.perptrader.simulator.LedgerMath;
import com.perptrader.simulator.SimulationEngine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Builds {@link AccountSummary} snapshots.
 *
 * <p>Bot runs push their latest marks through {@link #recordMarks} every tick so the REST
 * summary can value open positions without a market-data round trip.
 */
@Service
public class AccountSummaryService {

    private final SimulationEngine simulationEngine;
    private final Map<String, Map<String, BigDecimal>> marksByAccount = new ConcurrentHashMap<>();

    public AccountSummaryService(SimulationEngine simulationEngine) {
        this.simulationEngine = simulationEngine;
    }

    /**
     * Summary of a persisted account valued at the last recorded marks.
     *
     * @throws ResourceNotFoundException if the account does not exist
     */
    public AccountSummary getSummary(String accountName) {
        if (simulationEngine.findAccount(accountName).isEmpty()) {
            throw new ResourceNotFoundException("Account", accountName);
        }
        return summarize(simulationEngine, accountName, marksByAccount.getOrDefault(accountName, Map.of()), Instant.now());
    }

    public void recordMarks(String accountName, Map<String, BigDecimal> marks) {
        marksByAccount.computeIfAbsent(accountName, k -> new ConcurrentHashMap<>()).putAll(marks);
    }

    public void clearMarks(String accountName) {
        marksByAccount.remove(accountName);
    }

    /** Summarizes {@code accountName} on any engine (live or backtest) at the given marks. */
    public AccountSummary summarize(
            SimulationEngine engine, String accountName, Map<String, BigDecimal> marks, Instant now) {
        Account account = engine.getOrCreateAccount(accountName);
        List<Position> open = engine.getOpenPositions(accountName);

        BigDecimal lockedMargin = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        for (Position position : open) {
            lockedMargin = lockedMargin.add(position.getMargin());
            BigDecimal mark = marks.get(position.getSymbol());
            if (mark != null) {
                unrealized = unrealized.add(engine.markToMarket(position, mark));
            }
        }

        BigDecimal equity = account.getBalance().add(lockedMargin).add(unrealized);
        BigDecimal netPnl = equity.subtract(account.getStartingEquity());
        BigDecimal winRate = account.getTotalTrades() == 0
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(account.getWinningTrades())
                        .multiply(LedgerMath.HUNDRED)
                        .divide(BigDecimal.valueOf(account.getTotalTrades()), 2, RoundingMode.HALF_UP);

        return AccountSummary.builder()
                .accountName(accountName)
                .startingEquity(LedgerMath.display(account.getStartingEquity()))
                .balance(LedgerMath.display(account.getBalance()))
                .lockedMargin(LedgerMath.display(lockedMargin))
                .unrealizedPnl(LedgerMath.display(unrealized))
                .equity(LedgerMath.display(equity))
                .realizedPnl(LedgerMath.display(account.getRealizedPnl()))
                .totalFees(LedgerMath.display(account.getTotalFees()))
                .netPnl(LedgerMath.display(netPnl))
                .returnPercent(LedgerMath.percentOf(netPnl, account.getStartingEquity()).setScale(2, RoundingMode.HALF_UP))
                .totalTrades(account.getTotalTrades())
                .winningTrades(account.getWinningTrades())
                .losingTrades(account.getLosingTrades())
                .winRate(winRate)
                .peakEquity(LedgerMath.display(account.getPeakEquity()))
                .maxDrawdownPercent(account.getMaxDrawdownPercent())
                .openPositions(open)
                .generatedAt(now)
                .build();
    }
}
