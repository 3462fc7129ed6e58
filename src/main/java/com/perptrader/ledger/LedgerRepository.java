package com.perptrader.ledger;

import com.perptrader.domain.model.Account;
import com.perptrader.domain.model.Order;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for the ledger. Implementations hand out detached copies: callers mutate
 * what they load and persist it back with the save methods.
 *
 * <p>{@link #savePosition} must refuse a second OPEN position for the same account and
 * symbol by throwing a {@link com.perptrader.exception.BusinessException} with
 * {@code CONFLICT}, independently of any check the engine already made.
 */
public interface LedgerRepository {

    Optional<Account> findAccount(String accountName);

    Account saveAccount(Account account);

    Optional<Position> findPosition(String positionId);

    Optional<Position> findOpenPosition(String accountName, String symbol);

    List<Position> findOpenPositions(String accountName);

    Position savePosition(Position position);

    void saveTrade(Trade trade);

    boolean tradeExistsForPosition(String positionId);

    /** Closed trades of the account in close order. */
    List<Trade> findTrades(String accountName);

    void saveOrder(Order order);

    List<Order> findOrders(String accountName);

    /** Removes trades, orders and closed positions of the account. Open positions are untouched. */
    void deleteHistory(String accountName);
}
