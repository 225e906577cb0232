package com.querydigest.log.parser;

/**
 * Counters returned by each worker.
 */
class WorkerStats {
    public final long events;
    public final long dropped;

    public WorkerStats(long events, long dropped) {
        this.events = events;
        this.dropped = dropped;
    }
}
