package com.perptrader.mapper;

import com.perptrader.domain.model.Trade;
import com.perptrader.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TradeMapper {

    TradeEntity toEntity(Trade trade);

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);
}
