package com.atpwatcher.watcher.domain.target;

import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class WatchConfigRules {

    public static final int MIN_INTERVAL_SECONDS = 30;
    public static final int MAX_INTERVAL_SECONDS = 3600;

    public static int requireInterval(Integer seconds) {
        if (seconds == null) {
            throw InvalidWatchConfigException.missing("sampleIntervalSeconds");
        }
        if (seconds < MIN_INTERVAL_SECONDS || seconds > MAX_INTERVAL_SECONDS) {
            throw InvalidWatchConfigException.of("Sample interval must be between %d and %d seconds, got %d"
                    .formatted(MIN_INTERVAL_SECONDS, MAX_INTERVAL_SECONDS, seconds));
        }
        return seconds;
    }

    public static BigDecimal requireMilestone(WatchKind kind, BigDecimal milestoneUsd) {
        if (!kind.tracksMilestone()) {
            if (milestoneUsd != null) {
                throw InvalidWatchConfigException.of("Milestone is only supported for portfolio watches");
            }
            return null;
        }
        if (milestoneUsd == null) {
            throw InvalidWatchConfigException.missing("milestoneUsd");
        }
        if (milestoneUsd.signum() <= 0) {
            throw InvalidWatchConfigException.of("Milestone must be positive, got " + milestoneUsd.toPlainString());
        }
        return milestoneUsd;
    }

    public static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw InvalidWatchConfigException.missing("id");
        }
        return id.trim();
    }
}
