package com.atpwatcher.watcher.application.controller.alert.mapper;

import com.atpwatcher.watcher.application.controller.alert.AlertResponse;
import com.atpwatcher.watcher.application.controller.alert.StatsResponse;
import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.store.StoreStats;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface AlertResponseMapper {

    AlertResponse toResponse(AlertRecord alert);

    StatsResponse toResponse(StoreStats stats);
}
