package com.atpwatcher.watcher.domain.target;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;

/**
 * Defaults applied to token watches added without explicit tiers or interval.
 * Built once at startup and replaced only through the registry.
 */
public record WatcherDefaults(TierConfig tokenTiers, int tokenIntervalSeconds) {

    public WatcherDefaults {
        if (tokenTiers == null) {
            throw InvalidWatchConfigException.missing("tokenTiers");
        }
        WatchConfigRules.requireInterval(tokenIntervalSeconds);
    }
}
