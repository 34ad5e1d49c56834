package com.atpwatcher.watcher.infrastructure.sink;

import com.atpwatcher.watcher.domain.alert.AlertRecord;

/**
 * One delivery route for alerts. Implementations call
 * {@link com.atpwatcher.watcher.domain.alert.AlertDeliveryTracker#confirm} once the
 * alert has left the process.
 */
public interface AlertChannel {

    String name();

    void publish(AlertRecord alert);
}
