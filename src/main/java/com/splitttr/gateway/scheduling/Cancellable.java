package com.splitttr.gateway.scheduling;

/**
 * Handle to a task scheduled with a {@link TaskScheduler}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Cancels the task. A task already running is allowed to finish.
     */
    void cancel();
}
