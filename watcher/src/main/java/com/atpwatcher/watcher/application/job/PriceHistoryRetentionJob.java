package com.atpwatcher.watcher.application.job;

import com.atpwatcher.watcher.application.config.WatcherProperties;
import com.atpwatcher.watcher.domain.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Trims price history to the newest N points per target. Runs on the watcher
 * scheduler thread, so it never races a cycle writing history.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceHistoryRetentionJob {

    private final StateStore stateStore;
    private final WatcherProperties properties;

    @Scheduled(cron = "${watcher.history.prune-cron}")
    public void pruneHistory() {
        var keep = properties.history().retentionPerTarget();
        try {
            var removed = stateStore.pruneHistory(keep);
            if (removed > 0) {
                log.info("Price history pruned: {} points removed, keeping newest {} per target", removed, keep);
            }
        } catch (DataAccessException e) {
            log.error("Price history pruning failed: {}", e.getMessage());
        }
    }
}
