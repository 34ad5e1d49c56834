package com.atpwatcher.watcher.domain.target;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

/**
 * Partial configuration change. Null fields keep the current value.
 */
@Builder
public record WatchTargetUpdate(
        String displayName,
        BigDecimal minorThreshold,
        BigDecimal majorThreshold,
        BigDecimal criticalThreshold,
        Boolean minorEnabled,
        Boolean majorEnabled,
        Boolean criticalEnabled,
        Integer sampleIntervalSeconds,
        BigDecimal milestoneUsd
) {

    /**
     * Merges this update into {@code current} and validates the result.
     * Throws before anything is returned, so a rejected update leaves no trace.
     */
    public WatchTarget applyTo(WatchTarget current, Instant now) {
        var tiers = current.tierConfig();
        var mergedTiers = new TierConfig(
                minorThreshold != null ? minorThreshold : tiers.minor(),
                majorThreshold != null ? majorThreshold : tiers.major(),
                criticalThreshold != null ? criticalThreshold : tiers.critical());

        var toggles = current.alertToggles();
        var mergedToggles = new AlertToggles(
                minorEnabled != null ? minorEnabled : toggles.minor(),
                majorEnabled != null ? majorEnabled : toggles.major(),
                criticalEnabled != null ? criticalEnabled : toggles.critical());

        var interval = WatchConfigRules.requireInterval(
                sampleIntervalSeconds != null ? sampleIntervalSeconds : current.sampleIntervalSeconds());

        var milestone = current.milestoneUsd();
        var latched = current.thresholdLatched();
        if (milestoneUsd != null) {
            milestone = WatchConfigRules.requireMilestone(current.kind(), milestoneUsd);
            if (current.milestoneUsd() == null || milestone.compareTo(current.milestoneUsd()) != 0) {
                latched = false;
            }
        }

        return current.toBuilder()
                .displayName(displayName != null && !displayName.isBlank() ? displayName : current.displayName())
                .tierConfig(mergedTiers)
                .alertToggles(mergedToggles)
                .sampleIntervalSeconds(interval)
                .milestoneUsd(milestone)
                .thresholdLatched(latched)
                .updatedAt(now)
                .build();
    }
}
