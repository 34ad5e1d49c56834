package com.atpwatcher.watcher.domain.monitor;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import java.math.BigDecimal;

/**
 * Side channel for cycle outcomes. All callbacks run on the execution context.
 */
public interface MonitorEventListener {

    default void onSample(WatchTarget target, BigDecimal value) {
    }

    default void onFetchFailure(WatchTarget target, SignalFetchException error) {
    }

    default void onAlert(AlertRecord alert) {
    }

    default void onPersistenceFailure(WatchTarget target, String operation, RuntimeException error) {
    }
}
