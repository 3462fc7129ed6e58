package com.perptrader.mapper;

import com.perptrader.domain.model.Order;
import com.perptrader.entity.OrderEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface OrderMapper {

    OrderEntity toEntity(Order order);

    Order toDomain(OrderEntity entity);

    List<Order> toDomainList(List<OrderEntity> entities);
}
