package com.atpwatcher.watcher.domain.classification;

import com.atpwatcher.common.event.Severity;

public enum Tier {
    NONE,
    MINOR,
    MAJOR,
    CRITICAL;

    public Severity severity() {
        return switch (this) {
            case MINOR -> Severity.MINOR;
            case MAJOR -> Severity.MAJOR;
            case CRITICAL -> Severity.CRITICAL;
            case NONE -> throw new IllegalStateException("NONE carries no severity");
        };
    }
}
