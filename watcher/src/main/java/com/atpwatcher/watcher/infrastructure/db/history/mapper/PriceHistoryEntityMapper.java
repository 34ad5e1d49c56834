package com.atpwatcher.watcher.infrastructure.db.history.mapper;

import com.atpwatcher.watcher.domain.store.PriceHistoryPoint;
import com.atpwatcher.watcher.infrastructure.db.history.PriceHistoryEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface PriceHistoryEntityMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "sampleValue", source = "value")
    @Mapping(target = "sampledAt", source = "timestamp")
    PriceHistoryEntity toEntity(PriceHistoryPoint point);

    @Mapping(target = "value", source = "sampleValue")
    @Mapping(target = "timestamp", source = "sampledAt")
    PriceHistoryPoint toDomain(PriceHistoryEntity entity);
}
