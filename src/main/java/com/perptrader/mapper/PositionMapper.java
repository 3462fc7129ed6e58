package com.perptrader.mapper;

import com.perptrader.domain.model.Position;
import com.perptrader.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Position and PositionEntity.
 *
 * <p>The mark cache (lastPrice, unrealizedPnl) is not persisted. openSymbol is derived
 * from the status so the storage-level single-open-position constraint follows the domain.
 */
@Mapper
public interface PositionMapper {

    @Mapping(
            target = "openSymbol",
            expression =
                    "java(position.getStatus() == com.perptrader.domain.enums.PositionStatus.OPEN ? position.getSymbol() : null)")
    PositionEntity toEntity(Position position);

    @Mapping(target = "lastPrice", ignore = true)
    @Mapping(target = "unrealizedPnl", ignore = true)
    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
