package com.atpwatcher.watcher.application.service;

import com.atpwatcher.watcher.domain.registry.TargetStatus;
import com.atpwatcher.watcher.domain.registry.WatcherRegistry;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import com.atpwatcher.watcher.domain.target.WatchTargetConfig;
import com.atpwatcher.watcher.domain.target.WatchTargetUpdate;
import com.atpwatcher.watcher.domain.target.WatcherDefaults;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WatchCommandHandler {

    private final WatcherRegistry watcherRegistry;
    private final Counter watchesAddedCounter;
    private final Counter watchesUpdatedCounter;
    private final Counter watchesRemovedCounter;

    public WatchTarget addWatch(WatchTargetConfig config) {
        return watcherRegistry.addTarget(config, created -> watchesAddedCounter.increment());
    }

    public WatchTarget updateWatch(String id, WatchTargetUpdate update) {
        var target = watcherRegistry.updateConfig(id, update);
        watchesUpdatedCounter.increment();
        return target;
    }

    public void removeWatch(String id) {
        if (watcherRegistry.removeTarget(id)) {
            watchesRemovedCounter.increment();
        }
    }

    public TargetStatus startWatch(String id) {
        return watcherRegistry.startLoop(id);
    }

    public TargetStatus stopWatch(String id) {
        return watcherRegistry.stopLoop(id);
    }

    public WatcherDefaults updateDefaults(WatcherDefaults defaults) {
        return watcherRegistry.updateDefaults(defaults);
    }
}
