package com.atpwatcher.watcher.application.controller.watch;

import com.atpwatcher.watcher.domain.monitor.LoopState;
import com.atpwatcher.watcher.domain.target.WatchKind;
import java.math.BigDecimal;
import java.time.Instant;

public record WatchResponse(
        String id,
        String displayName,
        WatchKind kind,
        LoopState state,
        BigDecimal minorThreshold,
        BigDecimal majorThreshold,
        BigDecimal criticalThreshold,
        boolean minorEnabled,
        boolean majorEnabled,
        boolean criticalEnabled,
        int sampleIntervalSeconds,
        BigDecimal milestoneUsd,
        BigDecimal lastObservedValue,
        Instant lastSampleTime,
        boolean thresholdLatched,
        Instant createdAt,
        Instant updatedAt) {}
