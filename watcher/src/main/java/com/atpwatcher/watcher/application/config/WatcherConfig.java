package com.atpwatcher.watcher.application.config;

import com.atpwatcher.watcher.domain.alert.AlertDeliveryTracker;
import com.atpwatcher.watcher.domain.alert.AlertMessageFormatter;
import com.atpwatcher.watcher.domain.alert.AlertSink;
import com.atpwatcher.watcher.domain.classification.ThresholdClassifier;
import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import com.atpwatcher.watcher.domain.monitor.MonitorCollaborators;
import com.atpwatcher.watcher.domain.monitor.MonitorEventListener;
import com.atpwatcher.watcher.domain.monitor.MonitorScheduler;
import com.atpwatcher.watcher.domain.registry.WatcherRegistry;
import com.atpwatcher.watcher.domain.signal.SignalSource;
import com.atpwatcher.watcher.domain.store.PreferenceKeys;
import com.atpwatcher.watcher.domain.store.StateStore;
import com.atpwatcher.watcher.domain.suppression.SuppressionPolicy;
import com.atpwatcher.watcher.domain.target.WatcherDefaults;
import java.math.BigDecimal;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(WatcherProperties.class)
public class WatcherConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThresholdClassifier thresholdClassifier() {
        return new ThresholdClassifier();
    }

    @Bean
    public SuppressionPolicy suppressionPolicy() {
        return new SuppressionPolicy();
    }

    @Bean
    public AlertMessageFormatter alertMessageFormatter() {
        return new AlertMessageFormatter();
    }

    @Bean
    public AlertDeliveryTracker alertDeliveryTracker(MonitorScheduler monitorScheduler, StateStore stateStore) {
        return new AlertDeliveryTracker(monitorScheduler, stateStore);
    }

    @Bean
    public MonitorCollaborators monitorCollaborators(
            SignalSource signalSource,
            StateStore stateStore,
            AlertSink alertSink,
            ThresholdClassifier thresholdClassifier,
            SuppressionPolicy suppressionPolicy,
            AlertMessageFormatter alertMessageFormatter,
            MonitorEventListener monitorEventListener,
            Clock clock) {
        return MonitorCollaborators.builder()
                .signalSource(signalSource)
                .stateStore(stateStore)
                .alertSink(alertSink)
                .classifier(thresholdClassifier)
                .suppressionPolicy(suppressionPolicy)
                .messageFormatter(alertMessageFormatter)
                .eventListener(monitorEventListener)
                .clock(clock)
                .build();
    }

    /**
     * Configured token defaults, overridden by preferences persisted through
     * the defaults endpoint. Read once; later changes go through the registry.
     */
    @Bean
    public WatcherDefaults watcherDefaults(WatcherProperties properties, StateStore stateStore) {
        var configured = new WatcherDefaults(
                TierConfig.scaledFrom(properties.tokenDefaults().changeThreshold()),
                properties.tokenDefaults().intervalSeconds());
        try {
            var minor = stateStore.getPreference(PreferenceKeys.TOKEN_MINOR_THRESHOLD);
            var major = stateStore.getPreference(PreferenceKeys.TOKEN_MAJOR_THRESHOLD);
            var critical = stateStore.getPreference(PreferenceKeys.TOKEN_CRITICAL_THRESHOLD);
            var interval = stateStore.getPreference(PreferenceKeys.TOKEN_CHECK_INTERVAL);
            if (minor.isEmpty() || major.isEmpty() || critical.isEmpty() || interval.isEmpty()) {
                return configured;
            }
            var stored = new WatcherDefaults(
                    new TierConfig(new BigDecimal(minor.get()), new BigDecimal(major.get()), new BigDecimal(critical.get())),
                    Integer.parseInt(interval.get()));
            log.info("Using stored token defaults: tiers={}, interval={}s", stored.tokenTiers(), stored.tokenIntervalSeconds());
            return stored;
        } catch (NumberFormatException | InvalidWatchConfigException e) {
            log.warn("Ignoring invalid stored token defaults: {}", e.getMessage());
            return configured;
        }
    }

    @Bean
    public WatcherRegistry watcherRegistry(
            MonitorScheduler monitorScheduler, MonitorCollaborators monitorCollaborators, WatcherDefaults watcherDefaults) {
        return new WatcherRegistry(monitorScheduler, monitorCollaborators, watcherDefaults);
    }
}
