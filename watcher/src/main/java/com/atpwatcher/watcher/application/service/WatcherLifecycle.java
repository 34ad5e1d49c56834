package com.atpwatcher.watcher.application.service;

import com.atpwatcher.watcher.application.config.WatcherProperties;
import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.registry.WatcherRegistry;
import com.atpwatcher.watcher.domain.target.AlertToggles;
import com.atpwatcher.watcher.domain.target.WatchKind;
import com.atpwatcher.watcher.domain.target.WatchTargetConfig;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers the configured portfolio and base token watches, then starts every
 * active loop once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WatcherLifecycle {

    private final WatcherProperties properties;
    private final WatcherRegistry watcherRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.autostart()) {
            log.info("Watcher autostart disabled, loops stay idle");
            return;
        }
        registerFixedTargets();
        watcherRegistry.start();
    }

    void registerFixedTargets() {
        var portfolio = properties.portfolio();
        if (portfolio.enabled() && !portfolio.walletAddress().isBlank()) {
            watcherRegistry.ensureTarget(WatchTargetConfig.builder()
                    .id(portfolio.walletAddress())
                    .displayName(portfolio.displayName())
                    .kind(WatchKind.PORTFOLIO)
                    .tierConfig(TierConfig.scaledFrom(portfolio.changeThreshold()))
                    .alertToggles(AlertToggles.ALL_ENABLED)
                    .sampleIntervalSeconds(portfolio.intervalSeconds())
                    .milestoneUsd(portfolio.milestoneUsd())
                    .build());
        } else {
            if (portfolio.enabled()) {
                log.warn("Portfolio watch enabled but no wallet address configured, skipping");
            } else if (!portfolio.walletAddress().isBlank()) {
                watcherRegistry.removeTarget(portfolio.walletAddress());
            }
        }

        var baseToken = properties.baseToken();
        if (baseToken.enabled()) {
            watcherRegistry.ensureTarget(WatchTargetConfig.builder()
                    .id(baseToken.id())
                    .displayName(baseToken.displayName())
                    .kind(WatchKind.BASE_TOKEN)
                    .tierConfig(new TierConfig(
                            baseToken.minorThreshold(), baseToken.majorThreshold(), baseToken.criticalThreshold()))
                    .alertToggles(AlertToggles.ALL_ENABLED)
                    .sampleIntervalSeconds(baseToken.intervalSeconds())
                    .build());
        } else {
            watcherRegistry.removeTarget(baseToken.id());
        }
    }

    @PreDestroy
    public void shutdown() {
        watcherRegistry.stop();
    }
}
