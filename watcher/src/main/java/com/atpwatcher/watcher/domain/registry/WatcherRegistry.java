package com.atpwatcher.watcher.domain.registry;

import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import com.atpwatcher.watcher.domain.exceptions.WatchTargetNotFoundException;
import com.atpwatcher.watcher.domain.monitor.LoopState;
import com.atpwatcher.watcher.domain.monitor.MonitorCollaborators;
import com.atpwatcher.watcher.domain.monitor.MonitorLoop;
import com.atpwatcher.watcher.domain.monitor.MonitorScheduler;
import com.atpwatcher.watcher.domain.store.PreferenceKeys;
import com.atpwatcher.watcher.domain.target.AlertToggles;
import com.atpwatcher.watcher.domain.target.WatchConfigRules;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import com.atpwatcher.watcher.domain.target.WatchTargetConfig;
import com.atpwatcher.watcher.domain.target.WatchTargetUpdate;
import com.atpwatcher.watcher.domain.target.WatcherDefaults;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns one {@link MonitorLoop} per active target and applies configuration
 * commands while the loops run.
 *
 * <p>Every public method hops onto the scheduler's execution context, so commands
 * never interleave with a running cycle. The store is loaded lazily on first use;
 * {@link #start()} additionally arms the timers.
 */
@Slf4j
public class WatcherRegistry {

    private final MonitorScheduler scheduler;
    private final MonitorCollaborators collaborators;
    private final Map<String, MonitorLoop> loops = new LinkedHashMap<>();
    private volatile WatcherDefaults defaults;
    private volatile int activeCount;
    private boolean loaded;
    private boolean running;

    public WatcherRegistry(MonitorScheduler scheduler, MonitorCollaborators collaborators, WatcherDefaults defaults) {
        this.scheduler = scheduler;
        this.collaborators = collaborators;
        this.defaults = defaults;
    }

    public void start() {
        scheduler.runExclusive(() -> {
            if (running) {
                return;
            }
            ensureLoaded();
            running = true;
            loops.values().forEach(loop -> loop.start(scheduler, Duration.ZERO));
            log.info("Watcher registry started with {} targets", loops.size());
        });
    }

    public void stop() {
        scheduler.runExclusive(() -> {
            if (!running) {
                return;
            }
            loops.values().forEach(loop -> loop.stop(scheduler));
            running = false;
            log.info("Watcher registry stopped");
        });
    }

    /**
     * Registers a new target after one synchronous baseline fetch. Adding an id
     * that is already active returns the existing target untouched.
     */
    public WatchTarget addTarget(WatchTargetConfig config) {
        return addTarget(config, created -> {
        });
    }

    /** As {@link #addTarget(WatchTargetConfig)}; {@code onCreated} runs only when a new target was registered. */
    public WatchTarget addTarget(WatchTargetConfig config, Consumer<WatchTarget> onCreated) {
        return scheduler.callExclusive(() -> {
            ensureLoaded();
            var id = WatchConfigRules.requireId(config.id());
            var existing = loops.get(id);
            if (existing != null) {
                log.info("Watch {} already active, add ignored", id);
                return existing.target();
            }

            var now = now();
            var candidate = newTarget(id, config, now);
            var baseline = candidate.kind().sample(collaborators.signalSource(), id);
            var created = collaborators.stateStore().saveTarget(
                    candidate.toBuilder().lastObservedValue(baseline).lastSampleTime(now).build());

            var loop = register(created);
            if (running) {
                loop.start(scheduler, created.sampleInterval());
            }
            log.info("Added watch {} ({}) with baseline {}", id, created.kind(), baseline);
            onCreated.accept(created);
            return created;
        });
    }

    /**
     * Makes sure a configured fixed target exists without fetching a baseline.
     * Its first cycle seeds the value instead.
     */
    public WatchTarget ensureTarget(WatchTargetConfig config) {
        return scheduler.callExclusive(() -> {
            ensureLoaded();
            var id = WatchConfigRules.requireId(config.id());
            var existing = loops.get(id);
            if (existing != null) {
                return existing.target();
            }
            var stored = collaborators.stateStore().findTarget(id);
            var target = stored
                    .map(row -> row.toBuilder().active(true).updatedAt(now()).build())
                    .orElseGet(() -> newTarget(id, config, now()));
            var saved = collaborators.stateStore().saveTarget(target);
            var loop = register(saved);
            if (running) {
                loop.start(scheduler, Duration.ZERO);
            }
            log.info("Fixed watch {} ({}) registered", id, saved.kind());
            return saved;
        });
    }

    /** Cancels the loop and soft-deletes the target. Unknown ids are a no-op. */
    public boolean removeTarget(String id) {
        return scheduler.callExclusive(() -> {
            ensureLoaded();
            var loop = loops.remove(id);
            if (loop == null) {
                return false;
            }
            loop.stop(scheduler);
            collaborators.stateStore().deactivateTarget(id, now());
            activeCount = loops.size();
            log.info("Removed watch {}", id);
            return true;
        });
    }

    public WatchTarget updateConfig(String id, WatchTargetUpdate update) {
        return scheduler.callExclusive(() -> {
            var loop = requireLoop(id);
            var updated = update.applyTo(loop.target(), now());
            var saved = collaborators.stateStore().saveTarget(updated);
            loop.reconfigure(saved, scheduler);
            log.info("Updated watch {}: tiers={}, interval={}s", id, saved.tierConfig(), saved.sampleIntervalSeconds());
            return saved;
        });
    }

    public TargetStatus startLoop(String id) {
        return scheduler.callExclusive(() -> {
            var loop = requireLoop(id);
            loop.start(scheduler, Duration.ZERO);
            return new TargetStatus(loop.target(), loop.state());
        });
    }

    public TargetStatus stopLoop(String id) {
        return scheduler.callExclusive(() -> {
            var loop = requireLoop(id);
            loop.stop(scheduler);
            return new TargetStatus(loop.target(), loop.state());
        });
    }

    public List<WatchTarget> list() {
        return scheduler.callExclusive(() -> {
            ensureLoaded();
            return loops.values().stream().map(MonitorLoop::target).toList();
        });
    }

    public Optional<TargetStatus> find(String id) {
        return scheduler.callExclusive(() -> {
            ensureLoaded();
            return Optional.ofNullable(loops.get(id)).map(loop -> new TargetStatus(loop.target(), loop.state()));
        });
    }

    public RegistryStatus status() {
        return scheduler.callExclusive(() -> {
            ensureLoaded();
            var targets = loops.values().stream()
                    .map(loop -> new TargetStatus(loop.target(), loop.state()))
                    .toList();
            return new RegistryStatus(running, targets.size(), targets);
        });
    }

    public WatcherDefaults defaults() {
        return defaults;
    }

    public WatcherDefaults updateDefaults(WatcherDefaults updated) {
        return scheduler.callExclusive(() -> {
            var store = collaborators.stateStore();
            store.setPreference(PreferenceKeys.TOKEN_MINOR_THRESHOLD, updated.tokenTiers().minor().toPlainString());
            store.setPreference(PreferenceKeys.TOKEN_MAJOR_THRESHOLD, updated.tokenTiers().major().toPlainString());
            store.setPreference(PreferenceKeys.TOKEN_CRITICAL_THRESHOLD, updated.tokenTiers().critical().toPlainString());
            store.setPreference(PreferenceKeys.TOKEN_CHECK_INTERVAL, String.valueOf(updated.tokenIntervalSeconds()));
            defaults = updated;
            log.info("Token defaults updated: tiers={}, interval={}s", updated.tokenTiers(), updated.tokenIntervalSeconds());
            return updated;
        });
    }

    /** Number of registered targets, readable from any thread. */
    public int activeCount() {
        return activeCount;
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        var rows = collaborators.stateStore().findActiveTargets();
        rows.forEach(this::register);
        loaded = true;
        log.info("Rehydrated {} active targets from store", rows.size());
    }

    private MonitorLoop register(WatchTarget target) {
        var loop = new MonitorLoop(target, collaborators);
        loops.put(target.id(), loop);
        activeCount = loops.size();
        return loop;
    }

    private MonitorLoop requireLoop(String id) {
        ensureLoaded();
        var loop = loops.get(id);
        if (loop == null) {
            throw WatchTargetNotFoundException.of(id);
        }
        return loop;
    }

    private WatchTarget newTarget(String id, WatchTargetConfig config, Instant now) {
        if (config.kind() == null) {
            throw InvalidWatchConfigException.missing("kind");
        }
        var current = defaults;
        var tiers = config.tierConfig() != null ? config.tierConfig() : current.tokenTiers();
        var interval = WatchConfigRules.requireInterval(
                config.sampleIntervalSeconds() != null ? config.sampleIntervalSeconds() : current.tokenIntervalSeconds());
        var milestone = WatchConfigRules.requireMilestone(config.kind(), config.milestoneUsd());
        var createdAt = collaborators.stateStore().findTarget(id).map(WatchTarget::createdAt).orElse(now);

        return WatchTarget.builder()
                .id(id)
                .displayName(config.displayName() != null && !config.displayName().isBlank() ? config.displayName() : id)
                .kind(config.kind())
                .tierConfig(tiers)
                .alertToggles(config.alertToggles() != null ? config.alertToggles() : AlertToggles.ALL_ENABLED)
                .sampleIntervalSeconds(interval)
                .milestoneUsd(milestone)
                .lastObservedValue(BigDecimal.ZERO)
                .active(true)
                .thresholdLatched(false)
                .createdAt(createdAt)
                .updatedAt(now)
                .build();
    }

    private Instant now() {
        return collaborators.clock().instant();
    }
}
