package com.atpwatcher.watcher.application.controller.defaults;

import com.atpwatcher.watcher.application.service.WatchCommandHandler;
import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.registry.WatcherRegistry;
import com.atpwatcher.watcher.domain.target.WatcherDefaults;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/defaults")
@RequiredArgsConstructor
public class DefaultsController {

    private final WatcherRegistry watcherRegistry;
    private final WatchCommandHandler commandHandler;

    @GetMapping
    public DefaultsResponse getDefaults() {
        return toResponse(watcherRegistry.defaults());
    }

    @PutMapping
    public DefaultsResponse updateDefaults(@Valid @RequestBody DefaultsRequest request) {
        var defaults = new WatcherDefaults(
                new TierConfig(request.minorThreshold(), request.majorThreshold(), request.criticalThreshold()),
                request.sampleIntervalSeconds());
        return toResponse(commandHandler.updateDefaults(defaults));
    }

    private static DefaultsResponse toResponse(WatcherDefaults defaults) {
        var tiers = defaults.tokenTiers();
        return new DefaultsResponse(tiers.minor(), tiers.major(), tiers.critical(), defaults.tokenIntervalSeconds());
    }
}
