package com.atpwatcher.watcher.domain.monitor;

import com.atpwatcher.common.event.Severity;
import com.atpwatcher.common.event.TriggerType;
import com.atpwatcher.common.id.UlidGenerator;
import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.classification.Classification;
import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import com.atpwatcher.watcher.domain.store.PriceHistoryPoint;
import com.atpwatcher.watcher.domain.suppression.SuppressionMode;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * Drives the fetch, classify, suppress, emit, persist cycle for one target.
 *
 * <p>Not thread-safe. Every method is called from the scheduler's execution context.
 */
@Slf4j
public class MonitorLoop {

    private final MonitorCollaborators deps;
    private WatchTarget target;
    private LoopState state = LoopState.STOPPED;

    public MonitorLoop(WatchTarget target, MonitorCollaborators deps) {
        this.target = target;
        this.deps = deps;
    }

    public String targetId() {
        return target.id();
    }

    public WatchTarget target() {
        return target;
    }

    public LoopState state() {
        return state;
    }

    public void start(MonitorScheduler scheduler, Duration initialDelay) {
        if (state == LoopState.RUNNING) {
            return;
        }
        state = LoopState.RUNNING;
        scheduler.schedule(target.id(), this::runCycle, initialDelay, target.sampleInterval());
        log.info("Started watcher for {} ({}) every {}s", target.id(), target.kind(), target.sampleIntervalSeconds());
    }

    public void stop(MonitorScheduler scheduler) {
        scheduler.cancel(target.id());
        if (state == LoopState.RUNNING) {
            log.info("Stopped watcher for {}", target.id());
        }
        state = LoopState.STOPPED;
    }

    /** Swaps in new configuration; a changed interval takes effect from the next tick. */
    public void reconfigure(WatchTarget updated, MonitorScheduler scheduler) {
        var intervalChanged = updated.sampleIntervalSeconds() != target.sampleIntervalSeconds();
        target = updated;
        if (intervalChanged && state == LoopState.RUNNING) {
            scheduler.reschedule(target.id(), target.sampleInterval());
        }
    }

    public CycleOutcome runCycle() {
        if (state != LoopState.RUNNING || !target.active()) {
            return CycleOutcome.of(CycleOutcome.Status.SKIPPED);
        }
        try {
            return sample();
        } catch (RuntimeException e) {
            log.error("Unexpected error in cycle for {}", target.id(), e);
            return CycleOutcome.of(CycleOutcome.Status.FAILED);
        }
    }

    private CycleOutcome sample() {
        var snapshot = target;
        BigDecimal current;
        try {
            current = snapshot.kind().sample(deps.signalSource(), snapshot.id());
        } catch (SignalFetchException e) {
            log.warn("Fetch failed for {}: {}", snapshot.id(), e.getMessage());
            deps.eventListener().onFetchFailure(snapshot, e);
            return CycleOutcome.of(CycleOutcome.Status.FETCH_FAILED);
        }

        if (state != LoopState.RUNNING || !target.active()) {
            log.debug("Discarding sample for {}: watcher stopped during fetch", snapshot.id());
            return CycleOutcome.of(CycleOutcome.Status.DISCARDED);
        }

        var now = deps.clock().instant();
        var previous = snapshot.lastObservedValue();
        var classification = deps.classifier().classify(previous, current, snapshot.tierConfig());
        log.debug("Sampled {}: {} -> {} ({}%, {})",
                snapshot.id(), previous, current, classification.deltaPct(), classification.tier());

        var latched = snapshot.thresholdLatched();
        List<AlertRecord> alerts = new ArrayList<>();
        for (var mode : snapshot.kind().suppressionModes()) {
            var decision = deps.suppressionPolicy().decide(mode, snapshot, classification, current);
            if (mode == SuppressionMode.LEVEL_TRIGGERED) {
                latched = decision.latched();
            }
            if (decision.emit()) {
                alerts.add(buildAlert(mode, snapshot, classification, previous, current, now));
            }
        }
        alerts.forEach(alert -> emit(snapshot, alert));

        persist(snapshot, "price history", () -> deps.stateStore().appendPriceHistory(
                new PriceHistoryPoint(snapshot.id(), snapshot.displayName(), current, now)));

        var sampledLatch = latched;
        target = snapshot.withSample(current, now, sampledLatch);
        persist(snapshot, "sample state",
                () -> deps.stateStore().updateSampleState(snapshot.id(), current, now, sampledLatch));

        deps.eventListener().onSample(target, current);
        return CycleOutcome.sampled(current, alerts);
    }

    private AlertRecord buildAlert(SuppressionMode mode, WatchTarget snapshot, Classification classification,
                                   BigDecimal previous, BigDecimal current, Instant now) {
        var builder = AlertRecord.builder()
                .id(UlidGenerator.generate(now))
                .category(snapshot.kind().category())
                .targetId(snapshot.id())
                .displayName(snapshot.displayName())
                .previousValue(previous)
                .currentValue(current)
                .timestamp(now)
                .delivered(false);

        if (mode == SuppressionMode.LEVEL_TRIGGERED) {
            return builder
                    .triggerType(TriggerType.MILESTONE_REACHED)
                    .severity(Severity.INFO)
                    .threshold(snapshot.milestoneUsd())
                    .message(deps.messageFormatter().milestoneReached(snapshot, current))
                    .build();
        }
        var threshold = snapshot.tierConfig().thresholdFor(classification.tier());
        return builder
                .triggerType(TriggerType.PERCENT_CHANGE)
                .severity(classification.tier().severity())
                .deltaPct(classification.deltaPct())
                .threshold(threshold)
                .message(deps.messageFormatter().percentChange(snapshot, classification, previous, current, threshold))
                .build();
    }

    private void emit(WatchTarget snapshot, AlertRecord alert) {
        log.info("Alert {} [{} {}] for {}", alert.id(), alert.triggerType(), alert.severity(), alert.targetId());
        try {
            deps.alertSink().deliver(alert);
        } catch (RuntimeException e) {
            log.error("Alert sink rejected {}: {}", alert.id(), e.getMessage());
        }
        deps.eventListener().onAlert(alert);
        persist(snapshot, "alert", () -> deps.stateStore().appendAlert(alert));
    }

    private void persist(WatchTarget snapshot, String operation, Runnable write) {
        try {
            write.run();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to persist {} for {}: {}", operation, snapshot.id(), e.getMessage());
            deps.eventListener().onPersistenceFailure(snapshot, operation, e);
        }
    }
}
