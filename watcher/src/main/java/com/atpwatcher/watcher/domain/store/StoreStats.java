package com.atpwatcher.watcher.domain.store;

import lombok.Builder;

@Builder
public record StoreStats(
        long targets,
        long activeTargets,
        long alerts,
        long undeliveredAlerts,
        long historyPoints
) {
}
