package com.perptrader.repository.jpa;

import com.perptrader.domain.enums.PositionStatus;
import com.perptrader.entity.PositionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table. Open positions are looked up by
 * (account, symbol, status) on every engine call, backed by idx_positions_account_status.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    List<PositionEntity> findByAccountNameAndStatusOrderByOpenedAtAsc(String accountName, PositionStatus status);

    Optional<PositionEntity> findByAccountNameAndSymbolAndStatus(
            String accountName, String symbol, PositionStatus status);

    boolean existsByAccountNameAndOpenSymbolAndIdNot(String accountName, String openSymbol, String id);

    void deleteByAccountNameAndStatus(String accountName, PositionStatus status);
}
