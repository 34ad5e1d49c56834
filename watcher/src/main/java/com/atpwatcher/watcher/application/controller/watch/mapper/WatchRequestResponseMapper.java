package com.atpwatcher.watcher.application.controller.watch.mapper;

import com.atpwatcher.watcher.application.controller.watch.PricePointResponse;
import com.atpwatcher.watcher.application.controller.watch.RegistryStatusResponse;
import com.atpwatcher.watcher.application.controller.watch.UpdateWatchRequest;
import com.atpwatcher.watcher.application.controller.watch.WatchResponse;
import com.atpwatcher.watcher.domain.registry.RegistryStatus;
import com.atpwatcher.watcher.domain.registry.TargetStatus;
import com.atpwatcher.watcher.domain.store.PriceHistoryPoint;
import com.atpwatcher.watcher.domain.target.WatchTargetUpdate;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface WatchRequestResponseMapper {

    @Mapping(target = "id", source = "target.id")
    @Mapping(target = "displayName", source = "target.displayName")
    @Mapping(target = "kind", source = "target.kind")
    @Mapping(target = "minorThreshold", source = "target.tierConfig.minor")
    @Mapping(target = "majorThreshold", source = "target.tierConfig.major")
    @Mapping(target = "criticalThreshold", source = "target.tierConfig.critical")
    @Mapping(target = "minorEnabled", source = "target.alertToggles.minor")
    @Mapping(target = "majorEnabled", source = "target.alertToggles.major")
    @Mapping(target = "criticalEnabled", source = "target.alertToggles.critical")
    @Mapping(target = "sampleIntervalSeconds", source = "target.sampleIntervalSeconds")
    @Mapping(target = "milestoneUsd", source = "target.milestoneUsd")
    @Mapping(target = "lastObservedValue", source = "target.lastObservedValue")
    @Mapping(target = "lastSampleTime", source = "target.lastSampleTime")
    @Mapping(target = "thresholdLatched", source = "target.thresholdLatched")
    @Mapping(target = "createdAt", source = "target.createdAt")
    @Mapping(target = "updatedAt", source = "target.updatedAt")
    WatchResponse toResponse(TargetStatus status);

    RegistryStatusResponse toResponse(RegistryStatus status);

    PricePointResponse toResponse(PriceHistoryPoint point);

    WatchTargetUpdate toUpdate(UpdateWatchRequest request);
}
