package com.atpwatcher.watcher.domain.target;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import java.math.BigDecimal;
import lombok.Builder;

/**
 * Request to add a target. Null tiers, toggles or interval fall back to the
 * registry's {@link WatcherDefaults}.
 */
@Builder(toBuilder = true)
public record WatchTargetConfig(
        String id,
        String displayName,
        WatchKind kind,
        TierConfig tierConfig,
        AlertToggles alertToggles,
        Integer sampleIntervalSeconds,
        BigDecimal milestoneUsd
) {
}
