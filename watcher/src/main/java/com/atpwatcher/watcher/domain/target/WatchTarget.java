package com.atpwatcher.watcher.domain.target;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;

/**
 * Configuration and last-known state of one monitored entity.
 *
 * <p>{@code lastObservedValue} is zero until the first sample; the classifier
 * treats zero as a baseline and never alerts on it.
 */
@Builder(toBuilder = true)
public record WatchTarget(
        String id,
        String displayName,
        WatchKind kind,
        TierConfig tierConfig,
        AlertToggles alertToggles,
        int sampleIntervalSeconds,
        BigDecimal milestoneUsd,
        BigDecimal lastObservedValue,
        Instant lastSampleTime,
        boolean active,
        boolean thresholdLatched,
        Instant createdAt,
        Instant updatedAt
) {

    public Duration sampleInterval() {
        return Duration.ofSeconds(sampleIntervalSeconds);
    }

    public WatchTarget withSample(BigDecimal value, Instant sampledAt, boolean latched) {
        return toBuilder()
                .lastObservedValue(value)
                .lastSampleTime(sampledAt)
                .thresholdLatched(latched)
                .build();
    }
}
