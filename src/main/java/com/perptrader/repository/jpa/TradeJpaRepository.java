package com.perptrader.repository.jpa;

import com.perptrader.entity.TradeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByAccountNameOrderByClosedAtAsc(String accountName);

    boolean existsByPositionId(String positionId);

    void deleteByAccountName(String accountName);
}
