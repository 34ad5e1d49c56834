package com.atpwatcher.watcher.infrastructure.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class TaskSchedulerMonitorSchedulerTest {

    private ThreadPoolTaskScheduler taskScheduler;
    private TaskSchedulerMonitorScheduler scheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("test-loop-");
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.initialize();
        scheduler = new TaskSchedulerMonitorScheduler(taskScheduler);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    void shouldRunExclusiveActionsOnSchedulerThread() {
        // when
        var threadName = scheduler.callExclusive(() -> Thread.currentThread().getName());

        // then
        assertThat(threadName).startsWith("test-loop-");
    }

    @Test
    void shouldRunNestedExclusiveCallInline() {
        // when
        var result = scheduler.callExclusive(() -> scheduler.callExclusive(() -> "nested"));

        // then
        assertThat(result).isEqualTo("nested");
    }

    @Test
    void shouldPropagateRuntimeExceptionFromExclusiveAction() {
        assertThatThrownBy(() -> scheduler.callExclusive(() -> {
            throw new IllegalArgumentException("bad config");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("bad config");
    }

    @Test
    void shouldFireImmediatelyAndRepeatUntilCancelled() throws InterruptedException {
        // given
        var ticks = new CountDownLatch(3);

        // when
        scheduler.schedule("t1", ticks::countDown, Duration.ZERO, Duration.ofMillis(10));

        // then
        assertThat(ticks.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.cancel("t1")).isTrue();
        assertThat(scheduler.isScheduled("t1")).isFalse();
        assertThat(scheduler.cancel("t1")).isFalse();
    }

    @Test
    void shouldReportRescheduleOfUnknownTimer() {
        assertThat(scheduler.reschedule("missing", Duration.ofSeconds(1))).isFalse();
    }

    @Test
    void shouldRunQueuedTasksAfterCurrentWork() throws InterruptedException {
        // given
        List<String> order = new CopyOnWriteArrayList<>();
        var done = new CountDownLatch(1);

        // when
        scheduler.runExclusive(() -> {
            scheduler.execute(() -> {
                order.add("queued");
                done.countDown();
            });
            order.add("current");
        });

        // then
        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(order).containsExactly("current", "queued");
    }
}
