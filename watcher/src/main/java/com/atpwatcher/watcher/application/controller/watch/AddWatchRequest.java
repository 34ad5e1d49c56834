package com.atpwatcher.watcher.application.controller.watch;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import com.atpwatcher.watcher.domain.target.AlertToggles;
import com.atpwatcher.watcher.domain.target.WatchKind;
import com.atpwatcher.watcher.domain.target.WatchTargetConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Adds a token price watch. Either a single {@code changeThreshold} (major and
 * critical derived as 3x and 5x), all three tier thresholds, or neither for the
 * registry defaults.
 */
public record AddWatchRequest(
        @NotBlank @Size(max = 64) String tokenId,
        @Size(max = 128) String displayName,
        @DecimalMin(value = "0", inclusive = false, message = "Change threshold must be positive")
                @DecimalMax(value = "100", message = "Change threshold must be at most 100")
                BigDecimal changeThreshold,
        BigDecimal minorThreshold,
        BigDecimal majorThreshold,
        BigDecimal criticalThreshold,
        Boolean minorEnabled,
        Boolean majorEnabled,
        Boolean criticalEnabled,
        @Min(30) @Max(3600) Integer sampleIntervalSeconds) {

    public WatchTargetConfig toConfig() {
        return WatchTargetConfig.builder()
                .id(tokenId)
                .displayName(displayName)
                .kind(WatchKind.TOKEN)
                .tierConfig(tiers())
                .alertToggles(new AlertToggles(
                        minorEnabled == null || minorEnabled,
                        majorEnabled == null || majorEnabled,
                        criticalEnabled == null || criticalEnabled))
                .sampleIntervalSeconds(sampleIntervalSeconds)
                .build();
    }

    private TierConfig tiers() {
        var explicit = minorThreshold != null || majorThreshold != null || criticalThreshold != null;
        if (explicit && changeThreshold != null) {
            throw InvalidWatchConfigException.of("Give either changeThreshold or tier thresholds, not both");
        }
        if (explicit) {
            return new TierConfig(minorThreshold, majorThreshold, criticalThreshold);
        }
        return changeThreshold != null ? TierConfig.scaledFrom(changeThreshold) : null;
    }
}
