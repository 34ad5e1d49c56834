package com.atpwatcher.watcher.domain.store;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable system of record for targets, alerts, price history and preferences.
 * Implementations report failures as {@link org.springframework.dao.DataAccessException}.
 */
public interface StateStore {

    /** Inserts or replaces the row for {@code target.id()}. */
    WatchTarget saveTarget(WatchTarget target);

    Optional<WatchTarget> findTarget(String id);

    List<WatchTarget> findActiveTargets();

    void updateSampleState(String id, BigDecimal value, Instant sampledAt, boolean thresholdLatched);

    void deactivateTarget(String id, Instant at);

    void appendAlert(AlertRecord alert);

    void markAlertDelivered(String alertId);

    List<AlertRecord> findRecentAlerts(int limit);

    void appendPriceHistory(PriceHistoryPoint point);

    /** Newest first. */
    List<PriceHistoryPoint> findPriceHistory(String targetId, int limit);

    /** Keeps the newest {@code keepPerTarget} points of every target; returns rows removed. */
    int pruneHistory(int keepPerTarget);

    Optional<String> getPreference(String key);

    void setPreference(String key, String value);

    StoreStats stats();
}
