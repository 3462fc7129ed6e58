package com.perptrader.ledger;

import com.perptrader.domain.enums.PositionStatus;
import com.perptrader.domain.model.Account;
import com.perptrader.domain.model.Order;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Heap-backed ledger used by the backtest replayer and by tests. Not thread-safe: a
 * backtest owns its repository exclusively.
 *
 * <p>Accounts and positions are copied on the way in and out so callers observe the same
 * detached-object semantics as with the JPA-backed ledger.
 */
public class InMemoryLedgerRepository implements LedgerRepository {

    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private final List<Order> orders = new ArrayList<>();

    @Override
    public Optional<Account> findAccount(String accountName) {
        return Optional.ofNullable(accounts.get(accountName)).map(a -> a.toBuilder().build());
    }

    @Override
    public Account saveAccount(Account account) {
        accounts.put(account.getName(), account.toBuilder().build());
        return account;
    }

    @Override
    public Optional<Position> findPosition(String positionId) {
        return Optional.ofNullable(positions.get(positionId)).map(p -> p.toBuilder().build());
    }

    @Override
    public Optional<Position> findOpenPosition(String accountName, String symbol) {
        return positions.values().stream()
                .filter(p -> p.getStatus() == PositionStatus.OPEN)
                .filter(p -> p.getAccountName().equals(accountName) && p.getSymbol().equals(symbol))
                .findFirst()
                .map(p -> p.toBuilder().build());
    }

    @Override
    public List<Position> findOpenPositions(String accountName) {
        return positions.values().stream()
                .filter(p -> p.getStatus() == PositionStatus.OPEN)
                .filter(p -> p.getAccountName().equals(accountName))
                .sorted(Comparator.comparing(Position::getOpenedAt))
                .map(p -> p.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public Position savePosition(Position position) {
        if (position.getStatus() == PositionStatus.OPEN) {
            boolean occupied = positions.values().stream()
                    .anyMatch(p -> p.getStatus() == PositionStatus.OPEN
                            && !p.getId().equals(position.getId())
                            && p.getAccountName().equals(position.getAccountName())
                            && p.getSymbol().equals(position.getSymbol()));
            if (occupied) {
                throw new BusinessException(
                        ErrorCode.CONFLICT,
                        "Open position already stored for " + position.getAccountName() + "/" + position.getSymbol());
            }
        }
        positions.put(position.getId(), position.toBuilder().build());
        return position;
    }

    @Override
    public void saveTrade(Trade trade) {
        if (tradeExistsForPosition(trade.getPositionId())) {
            throw new BusinessException(ErrorCode.CONFLICT, "Trade already recorded for position " + trade.getPositionId());
        }
        trades.add(trade);
    }

    @Override
    public boolean tradeExistsForPosition(String positionId) {
        return trades.stream().anyMatch(t -> t.getPositionId().equals(positionId));
    }

    @Override
    public List<Trade> findTrades(String accountName) {
        return trades.stream()
                .filter(t -> t.getAccountName().equals(accountName))
                .collect(Collectors.toList());
    }

    @Override
    public void saveOrder(Order order) {
        orders.add(order);
    }

    @Override
    public List<Order> findOrders(String accountName) {
        return orders.stream()
                .filter(o -> o.getAccountName().equals(accountName))
                .collect(Collectors.toList());
    }

    @Override
    public void deleteHistory(String accountName) {
        trades.removeIf(t -> t.getAccountName().equals(accountName));
        orders.removeIf(o -> o.getAccountName().equals(accountName));
        positions.values()
                .removeIf(p -> p.getAccountName().equals(accountName) && p.getStatus() == PositionStatus.CLOSED);
    }
}
