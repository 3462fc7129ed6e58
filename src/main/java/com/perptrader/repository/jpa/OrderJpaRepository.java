package com.perptrader.repository.jpa;

import com.perptrader.entity.OrderEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByAccountNameOrderByCreatedAtAsc(String accountName);

    void deleteByAccountName(String accountName);
}
