package com.atpwatcher.watcher.domain.suppression;

public enum SuppressionMode {
    /** Alert on every sample whose move versus the previous sample meets an enabled tier. */
    EDGE_TRIGGERED,
    /** Alert once when the value reaches the milestone; re-arm when it drops below. */
    LEVEL_TRIGGERED
}
