package com.perptrader.ledger;

import com.perptrader.domain.enums.PositionStatus;
import com.perptrader.domain.model.Account;
import com.perptrader.domain.model.Order;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.mapper.AccountMapper;
import com.perptrader.mapper.OrderMapper;
import com.perptrader.mapper.PositionMapper;
import com.perptrader.mapper.TradeMapper;
import com.perptrader.repository.jpa.AccountJpaRepository;
import com.perptrader.repository.jpa.OrderJpaRepository;
import com.perptrader.repository.jpa.PositionJpaRepository;
import com.perptrader.repository.jpa.TradeJpaRepository;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * H2/JPA-backed ledger used by live bot runs.
 *
 * <p>Every method joins the caller's transaction when one is active. The live loop wraps
 * each account's tick in a single transaction, so a failure anywhere in the tick rolls
 * back margin debits, position rows and trades together.
 *
 * <p>A second open position per (account, symbol) or a second trade per position is refused
 * with CONFLICT before anything is written, and that refusal leaves the caller's
 * transaction usable. uk_positions_account_open_symbol and uk_trades_position stay as the
 * backstop for concurrent writers; a violation there is not caught and fails the
 * transaction.
 */
@Component
@Transactional
public class JpaLedgerRepository implements LedgerRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaLedgerRepository.class);

    private final AccountJpaRepository accountJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final OrderJpaRepository orderJpaRepository;
    private final AccountMapper accountMapper;
    private final PositionMapper positionMapper;
    private final TradeMapper tradeMapper;
    private final OrderMapper orderMapper;

    public JpaLedgerRepository(
            AccountJpaRepository accountJpaRepository,
            PositionJpaRepository positionJpaRepository,
            TradeJpaRepository tradeJpaRepository,
            OrderJpaRepository orderJpaRepository,
            AccountMapper accountMapper,
            PositionMapper positionMapper,
            TradeMapper tradeMapper,
            OrderMapper orderMapper) {
        this.accountJpaRepository = accountJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
        this.orderJpaRepository = orderJpaRepository;
        this.accountMapper = accountMapper;
        this.positionMapper = positionMapper;
        this.tradeMapper = tradeMapper;
        this.orderMapper = orderMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findAccount(String accountName) {
        return accountJpaRepository.findById(accountName).map(accountMapper::toDomain);
    }

    @Override
    public Account saveAccount(Account account) {
        accountJpaRepository.save(accountMapper.toEntity(account));
        return account;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Position> findPosition(String positionId) {
        return positionJpaRepository.findById(positionId).map(positionMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Position> findOpenPosition(String accountName, String symbol) {
        return positionJpaRepository
                .findByAccountNameAndSymbolAndStatus(accountName, symbol, PositionStatus.OPEN)
                .map(positionMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> findOpenPositions(String accountName) {
        return positionMapper.toDomainList(
                positionJpaRepository.findByAccountNameAndStatusOrderByOpenedAtAsc(accountName, PositionStatus.OPEN));
    }

    @Override
    @Transactional(noRollbackFor = BusinessException.class)
    public Position savePosition(Position position) {
        if (position.isOpen()
                && positionJpaRepository.existsByAccountNameAndOpenSymbolAndIdNot(
                        position.getAccountName(), position.getSymbol(), position.getId())) {
            log.error(
                    "Storage rejected position {} for {}/{}: open position already exists",
                    position.getId(),
                    position.getAccountName(),
                    position.getSymbol());
            throw new BusinessException(
                    ErrorCode.CONFLICT,
                    "Open position already stored for " + position.getAccountName() + "/" + position.getSymbol(),
                    Map.of("positionId", position.getId()));
        }
        positionJpaRepository.saveAndFlush(positionMapper.toEntity(position));
        return position;
    }

    @Override
    @Transactional(noRollbackFor = BusinessException.class)
    public void saveTrade(Trade trade) {
        if (tradeJpaRepository.existsByPositionId(trade.getPositionId())) {
            throw new BusinessException(
                    ErrorCode.CONFLICT, "Trade already recorded for position " + trade.getPositionId());
        }
        tradeJpaRepository.saveAndFlush(tradeMapper.toEntity(trade));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean tradeExistsForPosition(String positionId) {
        return tradeJpaRepository.existsByPositionId(positionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findTrades(String accountName) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByAccountNameOrderByClosedAtAsc(accountName));
    }

    @Override
    public void saveOrder(Order order) {
        orderJpaRepository.save(orderMapper.toEntity(order));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findOrders(String accountName) {
        return orderMapper.toDomainList(orderJpaRepository.findByAccountNameOrderByCreatedAtAsc(accountName));
    }

    @Override
    public void deleteHistory(String accountName) {
        tradeJpaRepository.deleteByAccountName(accountName);
        orderJpaRepository.deleteByAccountName(accountName);
        positionJpaRepository.deleteByAccountNameAndStatus(accountName, PositionStatus.CLOSED);
        log.info("Deleted trade, order and closed-position history for account {}", accountName);
    }
}
