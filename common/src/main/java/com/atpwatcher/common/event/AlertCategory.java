package com.atpwatcher.common.event;

/**
 * Which watcher produced an alert.
 */
public enum AlertCategory {
    HOLDINGS,
    PRICE,
    BASE_TOKEN_PRICE
}
