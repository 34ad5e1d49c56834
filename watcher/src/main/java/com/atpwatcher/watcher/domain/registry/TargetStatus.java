package com.atpwatcher.watcher.domain.registry;

import com.atpwatcher.watcher.domain.monitor.LoopState;
import com.atpwatcher.watcher.domain.target.WatchTarget;

public record TargetStatus(WatchTarget target, LoopState state) {
}
