package com.querydigest.log.parser.accumulator;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline source for periodic snapshots. An interval of 0 creates a ticker that never fires.
 * {@link #stop()} may be called any number of times; only the first call has an effect.
 */
class RefreshTicker {

    private final long intervalNanos;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private long nextDue;

    RefreshTicker(long intervalMillis) {
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, intervalMillis));
        this.nextDue = System.nanoTime() + intervalNanos;
        if (intervalNanos == 0) {
            stopped.set(true);
        }
    }

    boolean isActive() {
        return !stopped.get();
    }

    /**
     * Milliseconds until the next tick, 0 when already due.
     */
    long millisUntilDue() {
        long remaining = nextDue - System.nanoTime();
        return remaining <= 0 ? 0 : TimeUnit.NANOSECONDS.toMillis(remaining) + 1;
    }

    boolean isDue() {
        return isActive() && nextDue - System.nanoTime() <= 0;
    }

    /**
     * Schedules the next tick one interval after now.
     */
    void rearm() {
        nextDue = System.nanoTime() + intervalNanos;
    }

    /**
     * @return true if this call disarmed the ticker
     */
    boolean stop() {
        return stopped.compareAndSet(false, true);
    }
}
