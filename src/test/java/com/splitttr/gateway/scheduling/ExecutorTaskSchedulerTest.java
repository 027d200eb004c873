package com.splitttr.gateway.scheduling;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorTaskSchedulerTest {

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsDelayedTask() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule(ran::countDown, Duration.ofMillis(10));

        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancelledTaskNeverRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200)).cancel();
        Thread.sleep(400);

        assertThat(runs).hasValue(0);
    }

    @Test
    void repeatsUntilCancelled() throws Exception {
        CountDownLatch threeRuns = new CountDownLatch(3);
        AtomicInteger runs = new AtomicInteger();

        Cancellable handle = scheduler.scheduleWithFixedDelay(() -> {
            runs.incrementAndGet();
            threeRuns.countDown();
        }, Duration.ZERO, Duration.ofMillis(5));
        assertThat(threeRuns.await(5, TimeUnit.SECONDS)).isTrue();
        handle.cancel();
        Thread.sleep(50);
        int afterCancel = runs.get();
        Thread.sleep(100);

        assertThat(runs).hasValue(afterCancel);
    }

    @Test
    void failingPeriodicTaskKeepsItsSchedule() throws Exception {
        CountDownLatch threeRuns = new CountDownLatch(3);

        Cancellable handle = scheduler.scheduleWithFixedDelay(() -> {
            threeRuns.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ZERO, Duration.ofMillis(5));

        assertThat(threeRuns.await(5, TimeUnit.SECONDS)).isTrue();
        handle.cancel();
    }
}
