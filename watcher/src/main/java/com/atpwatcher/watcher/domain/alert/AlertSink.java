package com.atpwatcher.watcher.domain.alert;

/**
 * Receives emitted alerts. Delivery is best-effort and must not throw.
 */
public interface AlertSink {

    void deliver(AlertRecord alert);
}
