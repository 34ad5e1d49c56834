package com.atpwatcher.watcher.domain.monitor;

public enum LoopState {
    STOPPED,
    RUNNING
}
