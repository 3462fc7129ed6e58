package com.perptrader.simulator;

import com.perptrader.domain.enums.CloseReason;
import com.perptrader.domain.enums.OrderStatus;
import com.perptrader.domain.enums.OrderType;
import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.PositionStatus;
import com.perptrader.domain.enums.RejectionReason;
import com.perptrader.domain.model.Account;
import com.perptrader.domain.model.Bar;
import com.perptrader.domain.model.Order;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.ledger.LedgerRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The accounting core shared by the live bot loop and the backtest replayer.
 *
 * <p>Every ledger mutation goes through this class:
 * <ul>
 *   <li><b>open:</b> validates leverage, duplicate exposure, size and margin, derives the
 *       slipped fill, debits margin plus taker fee, stores the position</li>
 *   <li><b>close:</b> derives the slipped exit, books gross PnL, fees, counters and the
 *       high-water mark, credits {@code margin + gross - exitFee}, records one Trade</li>
 *   <li><b>updateTrailingStop:</b> tightens a trailing stop, never loosens it</li>
 * </ul>
 * {@link #markToMarket} and {@link #checkRiskTriggers} are read-only.
 *
 * <p>Rejections are returned as values and never touch the account or positions. The engine
 * reloads state from the {@link LedgerRepository} on every call and is not thread-safe:
 * callers guarantee a single writer per account.
 */
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private final LedgerRepository ledgerRepository;
    private final EngineSettings settings;
    private final AccountDefaults accountDefaults;
    private final FillPriceCalculator fillPriceCalculator;
    private final FeeCalculator feeCalculator;

    public SimulationEngine(LedgerRepository ledgerRepository, EngineSettings settings, AccountDefaults accountDefaults) {
        this.ledgerRepository = ledgerRepository;
        this.settings = settings;
        this.accountDefaults = accountDefaults;
        this.fillPriceCalculator = new FillPriceCalculator(settings.getSlippageRate());
        this.feeCalculator = new FeeCalculator();
    }

    // ========================
    // ACCOUNTS
    // ========================

    /**
     * Returns the named account, creating it from the configured defaults on first use.
     */
    public Account getOrCreateAccount(String accountName) {
        return ledgerRepository.findAccount(accountName).orElseGet(() -> createAccount(accountName, null, Instant.now()));
    }

    /**
     * Creates the account with an explicit starting equity if it does not exist yet.
     * An existing account is returned unchanged.
     */
    public Account getOrCreateAccount(String accountName, BigDecimal startingEquity, Instant timestamp) {
        return ledgerRepository
                .findAccount(accountName)
                .orElseGet(() -> createAccount(accountName, startingEquity, timestamp));
    }

    /**
     * Restores the account to a fresh state and deletes its trade and order history so the
     * balance identity restarts from the new starting equity.
     *
     * @param startingEquity new starting equity, or null to keep the current one
     * @throws BusinessException if the account still has open positions
     */
    public Account resetAccount(String accountName, BigDecimal startingEquity) {
        Account account = getOrCreateAccount(accountName);
        List<Position> open = ledgerRepository.findOpenPositions(accountName);
        if (!open.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.ACCOUNT_HAS_OPEN_POSITIONS,
                    "Account " + accountName + " has " + open.size() + " open position(s); close them before reset");
        }
        BigDecimal equity = startingEquity != null ? startingEquity : account.getStartingEquity();
        ledgerRepository.deleteHistory(accountName);

        account.setStartingEquity(LedgerMath.money(equity));
        account.setBalance(LedgerMath.money(equity));
        account.setRealizedPnl(LedgerMath.money(BigDecimal.ZERO));
        account.setTotalFees(LedgerMath.money(BigDecimal.ZERO));
        account.setTotalTrades(0);
        account.setWinningTrades(0);
        account.setLosingTrades(0);
        account.setPeakEquity(LedgerMath.money(equity));
        account.setMaxDrawdownPercent(BigDecimal.ZERO);
        account.setUpdatedAt(Instant.now());
        ledgerRepository.saveAccount(account);

        log.info("Account {} reset to starting equity {}", accountName, LedgerMath.display(equity));
        return account;
    }

    private Account createAccount(String accountName, BigDecimal startingEquity, Instant timestamp) {
        BigDecimal equity = LedgerMath.money(startingEquity != null ? startingEquity : accountDefaults.getStartingEquity());
        Account account = Account.builder()
                .name(accountName)
                .startingEquity(equity)
                .balance(equity)
                .defaultLeverage(accountDefaults.getDefaultLeverage())
                .makerFeeRate(accountDefaults.getMakerFeeRate())
                .takerFeeRate(accountDefaults.getTakerFeeRate())
                .realizedPnl(LedgerMath.money(BigDecimal.ZERO))
                .totalFees(LedgerMath.money(BigDecimal.ZERO))
                .peakEquity(equity)
                .maxDrawdownPercent(BigDecimal.ZERO)
                .createdAt(timestamp)
                .updatedAt(timestamp)
                .build();
        ledgerRepository.saveAccount(account);
        log.info("Created account {} with starting equity {}", accountName, LedgerMath.display(equity));
        return account;
    }

    // ========================
    // OPEN
    // ========================

    /**
     * Opens a new position. Rejected without touching the ledger when the symbol is already
     * occupied for the account, the leverage is outside [1, maxLeverage], the size rounds to
     * zero, or margin plus entry fee exceeds the free balance.
     */
    public OpenResult open(OpenRequest request) {
        Account account = getOrCreateAccount(request.getAccountName());
        String symbol = request.getSymbol();
        PositionSide side = request.getSide();

        if (request.getReferencePrice() == null || request.getReferencePrice().signum() <= 0) {
            return rejectOpen(request, RejectionReason.INVALID_PRICE, "Reference price must be positive");
        }

        int leverage = request.getLeverage() != null ? request.getLeverage() : account.getDefaultLeverage();
        if (leverage < 1 || leverage > settings.getMaxLeverage()) {
            return rejectOpen(
                    request,
                    RejectionReason.LEVERAGE_OUT_OF_BOUNDS,
                    "Leverage " + leverage + " outside [1, " + settings.getMaxLeverage() + "]");
        }

        if (ledgerRepository.findOpenPosition(account.getName(), symbol).isPresent()) {
            return rejectOpen(request, RejectionReason.DUPLICATE_OPEN, "Position already open for " + symbol);
        }

        InstrumentSpec instrument = settings.instrumentFor(symbol);
        BigDecimal quantity = resolveQuantity(request, account, leverage, instrument);
        if (quantity.signum() <= 0) {
            return rejectOpen(request, RejectionReason.INVALID_SIZE, "Requested size rounds to zero");
        }

        BigDecimal fillPrice = fillPriceCalculator.entryFill(side, request.getReferencePrice(), instrument.getTickSize());
        BigDecimal notional = fillPrice.multiply(quantity);
        BigDecimal margin = notional.divide(BigDecimal.valueOf(leverage), LedgerMath.MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal entryFee = feeCalculator.takerFee(fillPrice, quantity, account.getTakerFeeRate());
        BigDecimal required = margin.add(entryFee);

        if (required.compareTo(account.getBalance()) > 0) {
            return rejectOpen(
                    request,
                    RejectionReason.INSUFFICIENT_MARGIN,
                    "Required " + LedgerMath.display(required) + " exceeds balance "
                            + LedgerMath.display(account.getBalance()));
        }

        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .accountName(account.getName())
                .symbol(symbol)
                .side(side)
                .size(quantity)
                .entryPrice(fillPrice)
                .referenceEntryPrice(request.getReferencePrice())
                .leverage(leverage)
                .margin(margin)
                .entryFee(entryFee)
                .stopLoss(roundOptional(request.getStopLoss(), instrument))
                .takeProfit(roundOptional(request.getTakeProfit(), instrument))
                .trailingStopPercent(request.getTrailingStopPercent())
                .strategyId(request.getStrategyId())
                .status(PositionStatus.OPEN)
                .openedAt(request.getTimestamp())
                .lastPrice(fillPrice)
                .unrealizedPnl(LedgerMath.money(BigDecimal.ZERO))
                .build();

        // Position first: a storage-level duplicate must fail before any cash moves.
        try {
            ledgerRepository.savePosition(position);
        } catch (BusinessException e) {
            if (e.getErrorCode() != ErrorCode.CONFLICT) {
                throw e;
            }
            return rejectOpen(request, RejectionReason.DUPLICATE_OPEN, e.getMessage());
        }

        account.setBalance(account.getBalance().subtract(required));
        account.setTotalFees(account.getTotalFees().add(entryFee));
        account.setUpdatedAt(request.getTimestamp());
        ledgerRepository.saveAccount(account);

        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .accountName(account.getName())
                .positionId(position.getId())
                .symbol(symbol)
                .type(OrderType.MARKET_OPEN)
                .side(side.openingSide())
                .size(quantity)
                .requestedPrice(request.getReferencePrice())
                .fillPrice(fillPrice)
                .slippage(fillPrice.subtract(request.getReferencePrice()).abs())
                .fee(entryFee)
                .status(OrderStatus.FILLED)
                .createdAt(request.getTimestamp())
                .build();
        ledgerRepository.saveOrder(order);

        log.info(
                "Opened {} {} {} @ {} (ref {}, lev {}x, margin {}, fee {}) for account {}",
                side,
                quantity.stripTrailingZeros().toPlainString(),
                symbol,
                fillPrice,
                request.getReferencePrice(),
                leverage,
                LedgerMath.display(margin),
                LedgerMath.display(entryFee),
                account.getName());
        return OpenResult.opened(position, order);
    }

    private BigDecimal resolveQuantity(OpenRequest request, Account account, int leverage, InstrumentSpec instrument) {
        Sizing sizing = request.getSizing();
        if (sizing == null || sizing.getAmount() == null || sizing.getAmount().signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal reference = request.getReferencePrice();
        BigDecimal raw = switch (sizing.getKind()) {
            case QUANTITY -> sizing.getAmount();
            case NOTIONAL -> sizing.getAmount().divide(reference, 12, RoundingMode.DOWN);
            case BALANCE_PERCENT -> account.getBalance()
                    .multiply(sizing.getAmount())
                    .divide(LedgerMath.HUNDRED, 12, RoundingMode.DOWN)
                    .multiply(BigDecimal.valueOf(leverage))
                    .divide(reference, 12, RoundingMode.DOWN);
        };
        return FillPriceCalculator.roundDownToStep(raw, instrument.getQuantityStep());
    }

    private BigDecimal roundOptional(BigDecimal price, InstrumentSpec instrument) {
        return price == null ? null : FillPriceCalculator.roundToTick(price, instrument.getTickSize());
    }

    private OpenResult rejectOpen(OpenRequest request, RejectionReason reason, String message) {
        log.warn(
                "Open rejected for account {} {} {}: {} ({})",
                request.getAccountName(),
                request.getSide(),
                request.getSymbol(),
                reason,
                message);
        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .accountName(request.getAccountName())
                .symbol(request.getSymbol())
                .type(OrderType.MARKET_OPEN)
                .side(request.getSide() != null ? request.getSide().openingSide() : null)
                .requestedPrice(request.getReferencePrice())
                .status(OrderStatus.REJECTED)
                .rejectionReason(reason)
                .message(message)
                .createdAt(request.getTimestamp())
                .build();
        ledgerRepository.saveOrder(order);
        return OpenResult.rejected(reason, message);
    }

    // ========================
    // CLOSE
    // ========================

    public CloseResult close(Position position, BigDecimal referencePrice, CloseReason reason, Instant timestamp) {
        return close(position.getId(), referencePrice, reason, timestamp);
    }

    /**
     * Closes an open position at the slipped reference price and records exactly one Trade.
     * The position is reloaded from the ledger, so a stale or repeated close is rejected with
     * POSITION_NOT_OPEN and credits nothing.
     */
    public CloseResult close(String positionId, BigDecimal referencePrice, CloseReason reason, Instant timestamp) {
        Optional<Position> stored = ledgerRepository.findPosition(positionId);
        if (stored.isEmpty() || !stored.get().isOpen() || ledgerRepository.tradeExistsForPosition(positionId)) {
            log.warn("Close rejected for position {} ({}): position is not open", positionId, reason);
            return CloseResult.rejected(RejectionReason.POSITION_NOT_OPEN, "Position " + positionId + " is not open");
        }
        if (referencePrice == null || referencePrice.signum() <= 0) {
            log.warn("Close rejected for position {}: invalid reference price {}", positionId, referencePrice);
            return CloseResult.rejected(RejectionReason.INVALID_PRICE, "Reference price must be positive");
        }

        Position position = stored.get();
        Account account = ledgerRepository
                .findAccount(position.getAccountName())
                .orElseThrow(() -> new BusinessException(
                        ErrorCode.INTERNAL_ERROR, "Account missing for position " + positionId));

        InstrumentSpec instrument = settings.instrumentFor(position.getSymbol());
        BigDecimal exitPrice = fillPriceCalculator.exitFill(position.getSide(), referencePrice, instrument.getTickSize());
        BigDecimal grossPnl = LedgerMath.money(exitPrice.subtract(position.getEntryPrice())
                .multiply(position.getSize())
                .multiply(position.getSide().sign()));
        BigDecimal exitFee = feeCalculator.takerFee(exitPrice, position.getSize(), account.getTakerFeeRate());
        BigDecimal netPnl = grossPnl.subtract(position.getEntryFee()).subtract(exitFee);

        position.setStatus(PositionStatus.CLOSED);
        position.setExitPrice(exitPrice);
        position.setClosedAt(timestamp);
        position.setLastPrice(referencePrice);
        position.setUnrealizedPnl(null);
        ledgerRepository.savePosition(position);

        account.setBalance(account.getBalance().add(position.getMargin()).add(grossPnl).subtract(exitFee));
        account.setRealizedPnl(account.getRealizedPnl().add(grossPnl));
        account.setTotalFees(account.getTotalFees().add(exitFee));
        account.setTotalTrades(account.getTotalTrades() + 1);
        if (netPnl.signum() > 0) {
            account.setWinningTrades(account.getWinningTrades() + 1);
        } else {
            account.setLosingTrades(account.getLosingTrades() + 1);
        }
        updateHighWaterMark(account);
        account.setUpdatedAt(timestamp);
        ledgerRepository.saveAccount(account);

        Trade trade = Trade.builder()
                .id(UUID.randomUUID().toString())
                .accountName(account.getName())
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .size(position.getSize())
                .leverage(position.getLeverage())
                .margin(position.getMargin())
                .entryPrice(position.getEntryPrice())
                .exitPrice(exitPrice)
                .grossPnl(grossPnl)
                .entryFee(position.getEntryFee())
                .exitFee(exitFee)
                .netPnl(netPnl)
                .pnlPercent(LedgerMath.percentOf(netPnl, position.getMargin()))
                .closeReason(reason)
                .strategyId(position.getStrategyId())
                .openedAt(position.getOpenedAt())
                .closedAt(timestamp)
                .build();
        ledgerRepository.saveTrade(trade);

        ledgerRepository.saveOrder(Order.builder()
                .id(UUID.randomUUID().toString())
                .accountName(account.getName())
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .type(reason.toOrderType())
                .side(position.getSide().closingSide())
                .size(position.getSize())
                .requestedPrice(referencePrice)
                .fillPrice(exitPrice)
                .slippage(exitPrice.subtract(referencePrice).abs())
                .fee(exitFee)
                .status(OrderStatus.FILLED)
                .createdAt(timestamp)
                .build());

        log.info(
                "Closed {} {} @ {} ({}): gross {}, fees {}, net {} | balance {}",
                position.getSide(),
                position.getSymbol(),
                exitPrice,
                reason,
                LedgerMath.display(grossPnl),
                LedgerMath.display(trade.getTotalFees()),
                LedgerMath.display(netPnl),
                LedgerMath.display(account.getBalance()));
        return CloseResult.closed(trade);
    }

    /**
     * Updates peak equity and max drawdown from realized equity (free balance plus margin
     * still locked in other open positions).
     */
    private void updateHighWaterMark(Account account) {
        BigDecimal lockedMargin = ledgerRepository.findOpenPositions(account.getName()).stream()
                .map(Position::getMargin)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal equity = account.getBalance().add(lockedMargin);

        if (account.getPeakEquity() == null || equity.compareTo(account.getPeakEquity()) > 0) {
            account.setPeakEquity(equity);
        }
        BigDecimal drawdown = LedgerMath.percentOf(account.getPeakEquity().subtract(equity), account.getPeakEquity());
        if (account.getMaxDrawdownPercent() == null || drawdown.compareTo(account.getMaxDrawdownPercent()) > 0) {
            account.setMaxDrawdownPercent(drawdown);
        }
    }

    // ========================
    // MARKING AND TRIGGERS
    // ========================

    /**
     * Unrealized PnL at {@code price}, before exit slippage and fees. Only the position's
     * display cache is updated; nothing is persisted.
     */
    public BigDecimal markToMarket(Position position, BigDecimal price) {
        BigDecimal unrealized = LedgerMath.money(price.subtract(position.getEntryPrice())
                .multiply(position.getSize())
                .multiply(position.getSide().sign()));
        position.setLastPrice(price);
        position.setUnrealizedPnl(unrealized);
        return unrealized;
    }

    /**
     * Price at which the adverse move has consumed the full margin:
     * {@code entry * (1 - 1/leverage)} for longs, {@code entry * (1 + 1/leverage)} for shorts.
     */
    public BigDecimal liquidationPrice(Position position) {
        BigDecimal inverse = BigDecimal.ONE.divide(BigDecimal.valueOf(position.getLeverage()), 12, RoundingMode.HALF_UP);
        BigDecimal factor = position.getSide() == PositionSide.LONG
                ? BigDecimal.ONE.subtract(inverse)
                : BigDecimal.ONE.add(inverse);
        return LedgerMath.money(position.getEntryPrice().multiply(factor));
    }

    /**
     * Evaluates protective exits against a single observed price.
     * Stop-loss exits at the observed price (it has already traded through the level),
     * take-profit at its level, liquidation at the liquidation price.
     */
    public Optional<RiskTrigger> checkRiskTriggers(Position position, BigDecimal price) {
        boolean isLong = position.getSide() == PositionSide.LONG;
        BigDecimal stop = position.getStopLoss();
        BigDecimal target = position.getTakeProfit();
        BigDecimal liquidation = liquidationPrice(position);

        boolean stopHit = stop != null && (isLong ? price.compareTo(stop) <= 0 : price.compareTo(stop) >= 0);
        boolean targetHit = target != null && (isLong ? price.compareTo(target) >= 0 : price.compareTo(target) <= 0);
        boolean liquidationHit = isLong ? price.compareTo(liquidation) <= 0 : price.compareTo(liquidation) >= 0;

        return resolve(position, stopHit, price, targetHit, target, liquidationHit, liquidation);
    }

    /**
     * Evaluates protective exits against a bar's full range. When the bar spans both the
     * stop and the target, the stop wins. A stop gapped through at the open fills at the open.
     */
    public Optional<RiskTrigger> checkRiskTriggers(Position position, Bar bar) {
        boolean isLong = position.getSide() == PositionSide.LONG;
        BigDecimal stop = position.getStopLoss();
        BigDecimal target = position.getTakeProfit();
        BigDecimal liquidation = liquidationPrice(position);

        boolean stopHit;
        BigDecimal stopExit = null;
        boolean targetHit;
        boolean liquidationHit;
        if (isLong) {
            stopHit = stop != null && bar.getLow().compareTo(stop) <= 0;
            if (stopHit) {
                stopExit = bar.getOpen().min(stop);
            }
            targetHit = target != null && bar.getHigh().compareTo(target) >= 0;
            liquidationHit = bar.getLow().compareTo(liquidation) <= 0;
        } else {
            stopHit = stop != null && bar.getHigh().compareTo(stop) >= 0;
            if (stopHit) {
                stopExit = bar.getOpen().max(stop);
            }
            targetHit = target != null && bar.getLow().compareTo(target) <= 0;
            liquidationHit = bar.getHigh().compareTo(liquidation) >= 0;
        }
        return resolve(position, stopHit, stopExit, targetHit, target, liquidationHit, liquidation);
    }

    private Optional<RiskTrigger> resolve(
            Position position,
            boolean stopHit,
            BigDecimal stopExit,
            boolean targetHit,
            BigDecimal targetExit,
            boolean liquidationHit,
            BigDecimal liquidationExit) {
        if (stopHit) {
            if (liquidationHit && stopBeyondLiquidation(position, liquidationExit)) {
                return Optional.of(new RiskTrigger(CloseReason.LIQUIDATION, liquidationExit));
            }
            return Optional.of(new RiskTrigger(CloseReason.STOP_LOSS, stopExit));
        }
        if (liquidationHit) {
            return Optional.of(new RiskTrigger(CloseReason.LIQUIDATION, liquidationExit));
        }
        if (targetHit) {
            return Optional.of(new RiskTrigger(CloseReason.TAKE_PROFIT, targetExit));
        }
        return Optional.empty();
    }

    private boolean stopBeyondLiquidation(Position position, BigDecimal liquidation) {
        return position.getSide() == PositionSide.LONG
                ? position.getStopLoss().compareTo(liquidation) < 0
                : position.getStopLoss().compareTo(liquidation) > 0;
    }

    /**
     * Moves a trailing stop toward {@code price}. Longs trail at {@code price * (1 - pct)},
     * shorts at {@code price * (1 + pct)}; the stop only ever tightens.
     *
     * @return true if the stop moved and was persisted
     */
    public boolean updateTrailingStop(Position position, BigDecimal price) {
        BigDecimal trailing = position.getTrailingStopPercent();
        if (trailing == null || trailing.signum() <= 0 || !position.isOpen()) {
            return false;
        }
        InstrumentSpec instrument = settings.instrumentFor(position.getSymbol());
        boolean isLong = position.getSide() == PositionSide.LONG;
        BigDecimal factor = isLong ? BigDecimal.ONE.subtract(trailing) : BigDecimal.ONE.add(trailing);
        BigDecimal candidate = FillPriceCalculator.roundToTick(price.multiply(factor), instrument.getTickSize());

        BigDecimal current = position.getStopLoss();
        boolean tighter = current == null
                || (isLong ? candidate.compareTo(current) > 0 : candidate.compareTo(current) < 0);
        if (!tighter) {
            return false;
        }
        position.setStopLoss(candidate);
        ledgerRepository.savePosition(position);
        log.debug("Trailing stop for {} {} moved {} -> {}", position.getSide(), position.getSymbol(), current, candidate);
        return true;
    }

    // ========================
    // QUERIES
    // ========================

    public List<Position> getOpenPositions(String accountName) {
        return ledgerRepository.findOpenPositions(accountName);
    }

    public Optional<Position> getOpenPosition(String accountName, String symbol) {
        return ledgerRepository.findOpenPosition(accountName, symbol);
    }

    public List<Trade> getTrades(String accountName) {
        return ledgerRepository.findTrades(accountName);
    }

    public List<Order> getOrders(String accountName) {
        return ledgerRepository.findOrders(accountName);
    }

    public Optional<Account> findAccount(String accountName) {
        return ledgerRepository.findAccount(accountName);
    }

    public EngineSettings getSettings() {
        return settings;
    }
}
