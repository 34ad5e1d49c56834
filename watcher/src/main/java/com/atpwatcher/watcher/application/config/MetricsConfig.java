package com.atpwatcher.watcher.application.config;

import com.atpwatcher.watcher.domain.registry.WatcherRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter samplesCounter(MeterRegistry registry) {
        return Counter.builder("watcher.samples")
                .description("Successful signal samples")
                .register(registry);
    }

    @Bean
    public Counter fetchFailuresCounter(MeterRegistry registry) {
        return Counter.builder("watcher.fetch.failures")
                .description("Signal fetches that failed after retries")
                .register(registry);
    }

    @Bean
    public Counter alertsEmittedCounter(MeterRegistry registry) {
        return Counter.builder("watcher.alerts.emitted")
                .description("Alerts pushed to the alert sink")
                .register(registry);
    }

    @Bean
    public Counter persistenceFailuresCounter(MeterRegistry registry) {
        return Counter.builder("watcher.persistence.failures")
                .description("State store writes that failed during a cycle")
                .register(registry);
    }

    @Bean
    public Counter watchesAddedCounter(MeterRegistry registry) {
        return Counter.builder("watches.added")
                .description("Watches added through the API")
                .register(registry);
    }

    @Bean
    public Counter watchesUpdatedCounter(MeterRegistry registry) {
        return Counter.builder("watches.updated")
                .description("Watch configuration updates")
                .register(registry);
    }

    @Bean
    public Counter watchesRemovedCounter(MeterRegistry registry) {
        return Counter.builder("watches.removed")
                .description("Watches removed through the API")
                .register(registry);
    }

    @Bean
    public Gauge activeTargetsGauge(MeterRegistry registry, WatcherRegistry watcherRegistry) {
        return Gauge.builder("watcher.targets.active", watcherRegistry::activeCount)
                .description("Targets currently held by the registry")
                .register(registry);
    }
}
