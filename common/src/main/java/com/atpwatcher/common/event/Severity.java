package com.atpwatcher.common.event;

public enum Severity {
    INFO,
    MINOR,
    MAJOR,
    CRITICAL
}
