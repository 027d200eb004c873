package com.splitttr.gateway.scheduling;

import java.time.Duration;

/**
 * Schedules deferred and periodic tasks. A {@link Cancellable} handle is returned for every
 * task so owners can cancel it.
 */
public interface TaskScheduler {

    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Runs {@code task} repeatedly, waiting {@code delay} between the end of one run and the
     * start of the next.
     */
    Cancellable scheduleWithFixedDelay(Runnable task, Duration initialDelay, Duration delay);
}
