package com.atpwatcher.watcher.infrastructure.scheduling;

import com.atpwatcher.watcher.domain.monitor.MonitorScheduler;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * {@link MonitorScheduler} on a single-threaded {@link ThreadPoolTaskScheduler}.
 *
 * <p>Tasks submitted through this class are marked as running on the execution
 * context, so a command issued from inside a cycle runs inline instead of
 * waiting on itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskSchedulerMonitorScheduler implements MonitorScheduler {

    private static final ThreadLocal<Boolean> ON_CONTEXT = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final ThreadPoolTaskScheduler taskScheduler;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    @Override
    public void schedule(String targetId, Runnable cycle, Duration initialDelay, Duration interval) {
        cancel(targetId);
        var startTime = taskScheduler.getClock().instant().plus(initialDelay);
        ScheduledFuture<?> future = taskScheduler.scheduleWithFixedDelay(onContext(cycle), startTime, interval);
        timers.put(targetId, new Timer(cycle, future));
        log.debug("Timer armed for {}: first tick in {}, then every {}", targetId, initialDelay, interval);
    }

    @Override
    public boolean reschedule(String targetId, Duration newInterval) {
        var timer = timers.get(targetId);
        if (timer == null) {
            return false;
        }
        schedule(targetId, timer.cycle(), newInterval, newInterval);
        return true;
    }

    @Override
    public boolean cancel(String targetId) {
        var timer = timers.remove(targetId);
        if (timer == null) {
            return false;
        }
        timer.future().cancel(false);
        return true;
    }

    @Override
    public boolean isScheduled(String targetId) {
        return timers.containsKey(targetId);
    }

    @Override
    public <T> T callExclusive(Supplier<T> action) {
        if (ON_CONTEXT.get()) {
            return action.get();
        }
        var future = taskScheduler.getScheduledExecutor().submit(() -> {
            ON_CONTEXT.set(Boolean.TRUE);
            try {
                return action.get();
            } finally {
                ON_CONTEXT.remove();
            }
        });
        try {
            return future.get();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Exclusive action failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the watcher thread", e);
        }
    }

    @Override
    public void execute(Runnable task) {
        taskScheduler.execute(onContext(task));
    }

    private static Runnable onContext(Runnable task) {
        return () -> {
            ON_CONTEXT.set(Boolean.TRUE);
            try {
                task.run();
            } finally {
                ON_CONTEXT.remove();
            }
        };
    }

    private record Timer(Runnable cycle, ScheduledFuture<?> future) {
    }
}
