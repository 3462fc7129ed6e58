package com.perptrader.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.PositionStatus;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.Trade;
import com.perptrader.entity.PositionEntity;
import com.perptrader.entity.TradeEntity;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.ledger.JpaLedgerRepository;
import com.perptrader.mapper.AccountMapper;
import com.perptrader.mapper.OrderMapper;
import com.perptrader.mapper.PositionMapper;
import com.perptrader.mapper.TradeMapper;
import com.perptrader.repository.jpa.AccountJpaRepository;
import com.perptrader.repository.jpa.OrderJpaRepository;
import com.perptrader.repository.jpa.PositionJpaRepository;
import com.perptrader.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for JpaLedgerRepository with mocked Spring Data repositories and real mappers.
 */
@ExtendWith(MockitoExtension.class)
class JpaLedgerRepositoryTest {

    @Mock
    private AccountJpaRepository accountJpaRepository;

    @Mock
    private PositionJpaRepository positionJpaRepository;

    @Mock
    private TradeJpaRepository tradeJpaRepository;

    @Mock
    private OrderJpaRepository orderJpaRepository;

    private JpaLedgerRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JpaLedgerRepository(
                accountJpaRepository,
                positionJpaRepository,
                tradeJpaRepository,
                orderJpaRepository,
                Mappers.getMapper(AccountMapper.class),
                Mappers.getMapper(PositionMapper.class),
                Mappers.getMapper(TradeMapper.class),
                Mappers.getMapper(OrderMapper.class));
    }

    @Test
    @DisplayName("Second open position for a symbol is refused before any write")
    void savePosition_duplicateOpen_conflictWithoutWrite() {
        when(positionJpaRepository.existsByAccountNameAndOpenSymbolAndIdNot("paper", "BTCUSDT", "p1"))
                .thenReturn(true);

        assertThatThrownBy(() -> repository.savePosition(position()))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONFLICT);
        verify(positionJpaRepository, never()).saveAndFlush(any(PositionEntity.class));
    }

    @Test
    @DisplayName("Closing a position skips the open-position check")
    void savePosition_closed_noDuplicateCheck() {
        Position closed = position().toBuilder().status(PositionStatus.CLOSED).build();

        repository.savePosition(closed);

        verify(positionJpaRepository, never()).existsByAccountNameAndOpenSymbolAndIdNot(any(), any(), any());
        verify(positionJpaRepository).saveAndFlush(any(PositionEntity.class));
    }

    @Test
    @DisplayName("Second trade for a position is refused before any write")
    void saveTrade_duplicate_conflictWithoutWrite() {
        when(tradeJpaRepository.existsByPositionId("p1")).thenReturn(true);
        Trade trade = Trade.builder().id("t1").accountName("paper").positionId("p1").build();

        assertThatThrownBy(() -> repository.saveTrade(trade))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONFLICT);
        verify(tradeJpaRepository, never()).saveAndFlush(any(TradeEntity.class));
    }

    @Test
    void findOpenPosition_mapsEntityToDomain() {
        PositionEntity entity = Mappers.getMapper(PositionMapper.class).toEntity(position());
        when(positionJpaRepository.findByAccountNameAndSymbolAndStatus("paper", "BTCUSDT", PositionStatus.OPEN))
                .thenReturn(Optional.of(entity));

        Position found = repository.findOpenPosition("paper", "BTCUSDT").orElseThrow();

        assertThat(found.getId()).isEqualTo("p1");
        assertThat(found.getEntryPrice()).isEqualByComparingTo("100");
    }

    @Test
    void deleteHistory_removesClosedPositionsOnly() {
        repository.deleteHistory("paper");

        verify(tradeJpaRepository).deleteByAccountName("paper");
        verify(orderJpaRepository).deleteByAccountName("paper");
        verify(positionJpaRepository).deleteByAccountNameAndStatus("paper", PositionStatus.CLOSED);
    }

    private Position position() {
        return Position.builder()
                .id("p1")
                .accountName("paper")
                .symbol("BTCUSDT")
                .side(PositionSide.LONG)
                .size(BigDecimal.ONE)
                .entryPrice(new BigDecimal("100"))
                .leverage(2)
                .margin(new BigDecimal("50"))
                .entryFee(new BigDecimal("0.05"))
                .status(PositionStatus.OPEN)
                .openedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }
}
