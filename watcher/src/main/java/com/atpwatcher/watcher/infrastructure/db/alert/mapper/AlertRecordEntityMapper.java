package com.atpwatcher.watcher.infrastructure.db.alert.mapper;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.infrastructure.db.alert.AlertRecordEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface AlertRecordEntityMapper {

    @Mapping(target = "triggeredAt", source = "timestamp")
    AlertRecordEntity toEntity(AlertRecord alert);

    @Mapping(target = "timestamp", source = "triggeredAt")
    AlertRecord toDomain(AlertRecordEntity entity);
}
