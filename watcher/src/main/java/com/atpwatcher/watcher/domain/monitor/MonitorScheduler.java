package com.atpwatcher.watcher.domain.monitor;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Owns the per-target timers and the single execution context they run on.
 *
 * <p>Timers are fixed-delay: the next tick is armed once the current cycle has
 * returned. Everything submitted through {@link #callExclusive} and
 * {@link #execute} runs on the same context, never concurrently with a cycle.
 */
public interface MonitorScheduler {

    /** Arms a repeating timer, replacing any timer already held for {@code targetId}. */
    void schedule(String targetId, Runnable cycle, Duration initialDelay, Duration interval);

    /**
     * Cancels the current timer and re-arms the same cycle so the first tick
     * comes {@code newInterval} from now. Returns false when nothing was scheduled.
     */
    boolean reschedule(String targetId, Duration newInterval);

    boolean cancel(String targetId);

    boolean isScheduled(String targetId);

    /** Runs {@code action} on the execution context and waits for its result. */
    <T> T callExclusive(Supplier<T> action);

    default void runExclusive(Runnable action) {
        callExclusive(() -> {
            action.run();
            return null;
        });
    }

    /** Queues {@code task} on the execution context without waiting. */
    void execute(Runnable task);
}
