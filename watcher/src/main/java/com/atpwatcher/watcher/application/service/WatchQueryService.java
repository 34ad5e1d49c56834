package com.atpwatcher.watcher.application.service;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.store.PriceHistoryPoint;
import com.atpwatcher.watcher.domain.store.StateStore;
import com.atpwatcher.watcher.domain.store.StoreStats;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read-only views straight from the store. Reads may run on web threads; only
 * writes are confined to the watcher thread.
 */
@Component
@RequiredArgsConstructor
public class WatchQueryService {

    static final int MAX_HISTORY = 1000;
    static final int MAX_ALERTS = 500;

    private final StateStore stateStore;

    public List<PriceHistoryPoint> priceHistory(String targetId, int limit) {
        return stateStore.findPriceHistory(targetId, clamp(limit, MAX_HISTORY));
    }

    public List<AlertRecord> recentAlerts(int limit) {
        return stateStore.findRecentAlerts(clamp(limit, MAX_ALERTS));
    }

    public StoreStats stats() {
        return stateStore.stats();
    }

    private static int clamp(int limit, int max) {
        return Math.max(1, Math.min(limit, max));
    }
}
