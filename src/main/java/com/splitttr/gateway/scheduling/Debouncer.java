package com.splitttr.gateway.scheduling;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collapses a burst of submissions into one delayed action on the newest value.
 *
 * <p>Every {@link #submit(Object)} re-arms the delay and replaces the pending value, so at most
 * one task is pending at any time. {@link #flush()} runs the pending action immediately on the
 * calling thread and {@link #cancel()} drops it.
 *
 * @param <T> the payload type
 */
public final class Debouncer<T> {

    private final TaskScheduler scheduler;
    private final Duration delay;
    private final Consumer<T> action;

    private T pending;
    private Cancellable timer;
    private long generation;

    public Debouncer(TaskScheduler scheduler, Duration delay, Consumer<T> action) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.action = Objects.requireNonNull(action, "action");
    }

    public synchronized void submit(T value) {
        Objects.requireNonNull(value, "value");
        if (timer != null) {
            timer.cancel();
        }
        pending = value;
        long armed = ++generation;
        timer = scheduler.schedule(() -> fire(armed), delay);
    }

    /**
     * Submits {@code value} only when nothing newer is waiting.
     */
    public synchronized boolean submitIfIdle(T value) {
        if (pending != null) {
            return false;
        }
        submit(value);
        return true;
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    public void flush() {
        T value = take(-1);
        if (value != null) {
            action.accept(value);
        }
    }

    public synchronized void cancel() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        pending = null;
        generation++;
    }

    private void fire(long armed) {
        T value = take(armed);
        if (value != null) {
            action.accept(value);
        }
    }

    // -1 takes whatever is pending regardless of which timer armed it
    private synchronized T take(long armed) {
        if (armed != -1 && armed != generation) {
            return null;
        }
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        T value = pending;
        pending = null;
        generation++;
        return value;
    }
}
