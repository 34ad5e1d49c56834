package com.atpwatcher.watcher.infrastructure.db.target.mapper;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.target.AlertToggles;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import com.atpwatcher.watcher.infrastructure.db.target.WatchTargetEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface WatchTargetEntityMapper {

    @Mapping(target = "minorThreshold", source = "tierConfig.minor")
    @Mapping(target = "majorThreshold", source = "tierConfig.major")
    @Mapping(target = "criticalThreshold", source = "tierConfig.critical")
    @Mapping(target = "minorEnabled", source = "alertToggles.minor")
    @Mapping(target = "majorEnabled", source = "alertToggles.major")
    @Mapping(target = "criticalEnabled", source = "alertToggles.critical")
    WatchTargetEntity toEntity(WatchTarget target);

    default WatchTarget toDomain(WatchTargetEntity entity) {
        return WatchTarget.builder()
                .id(entity.getId())
                .displayName(entity.getDisplayName())
                .kind(entity.getKind())
                .tierConfig(new TierConfig(
                        entity.getMinorThreshold(), entity.getMajorThreshold(), entity.getCriticalThreshold()))
                .alertToggles(new AlertToggles(
                        entity.isMinorEnabled(), entity.isMajorEnabled(), entity.isCriticalEnabled()))
                .sampleIntervalSeconds(entity.getSampleIntervalSeconds())
                .milestoneUsd(entity.getMilestoneUsd())
                .lastObservedValue(entity.getLastObservedValue())
                .lastSampleTime(entity.getLastSampleTime())
                .active(entity.isActive())
                .thresholdLatched(entity.isThresholdLatched())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
