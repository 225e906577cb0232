package com.querydigest.log.parser.accumulator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.parser.cache.SnapshotCache;
import com.querydigest.log.parser.model.QueryEvent;
import com.querydigest.log.parser.model.ServerInfo;
import com.querydigest.log.parser.model.Snapshot;

/**
 * Single consumer of the event queue and sole owner of the per-fingerprint entries and the global
 * counters, so nothing here is synchronized. Emits a non-final snapshot every refresh interval and
 * exactly one final snapshot once the queue is closed by {@link QueryEvent#END_OF_STREAM}.
 */
public class QueryStatsAggregator implements Callable<Snapshot> {

    private static final Logger logger = LoggerFactory.getLogger(QueryStatsAggregator.class);

    public enum State {
        RUNNING, DRAINING, DONE
    }

    private final BlockingQueue<QueryEvent> events;
    private final ServerInfo server;
    private final LongSupplier lineCounter;
    private final long refreshMillis;
    private final SnapshotListener listener;
    private final SnapshotCache cache;

    private final Map<FingerprintKey, QueryStatsEntry> entries = new HashMap<>();
    private volatile State state = State.RUNNING;
    private long startNanos;

    /**
     * @param server      identity parsed from the log preamble; counters are added to it
     * @param lineCounter lines read so far by the framer
     * @param refreshMillis interval of non-final snapshots, 0 to disable them
     * @param cache       where to store the final snapshot, or null when caching is disabled
     */
    public QueryStatsAggregator(BlockingQueue<QueryEvent> events, ServerInfo server, LongSupplier lineCounter,
            long refreshMillis, SnapshotListener listener, SnapshotCache cache) {
        this.events = events;
        this.server = server;
        this.lineCounter = lineCounter;
        this.refreshMillis = refreshMillis;
        this.listener = listener;
        this.cache = cache;
    }

    @Override
    public Snapshot call() throws Exception {
        logger.info("aggregator started");
        startNanos = System.nanoTime();
        RefreshTicker ticker = new RefreshTicker(refreshMillis);

        while (true) {
            QueryEvent event;
            if (ticker.isActive()) {
                if (ticker.isDue()) {
                    listener.onSnapshot(buildSnapshot(false));
                    ticker.rearm();
                    continue;
                }
                event = events.poll(ticker.millisUntilDue(), TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
            } else {
                event = events.take();
            }

            if (event == QueryEvent.END_OF_STREAM) {
                break;
            }
            accumulate(event);
        }

        state = State.DRAINING;
        ticker.stop();

        List<QueryEvent> remaining = new ArrayList<>();
        events.drainTo(remaining);
        for (QueryEvent event : remaining) {
            if (event != QueryEvent.END_OF_STREAM) {
                accumulate(event);
            }
        }

        Snapshot snapshot = buildSnapshot(true);
        if (cache != null) {
            cache.write(snapshot);
        }
        listener.onSnapshot(snapshot);

        state = State.DONE;
        logger.info("aggregator exiting: {} queries, {} fingerprints", server.getQueryCount(), entries.size());
        return snapshot;
    }

    /**
     * Folds one event into its fingerprint entry and the global counters.
     *
     * @throws IllegalStateException if two different fingerprints share a key
     */
    void accumulate(QueryEvent event) {
        server.incrementQueryCount();
        server.addBytes(event.bytesSent);
        server.observe(event.time);

        QueryStatsEntry entry = entries.get(event.key);
        if (entry == null) {
            entry = new QueryStatsEntry(event.key, event.fingerprint, event.schema);
            entries.put(event.key, entry);
        } else if (!entry.getFingerprint().equals(event.fingerprint)) {
            throw new IllegalStateException(String.format("fingerprint key collision on %s: '%s' vs '%s'",
                    event.key, entry.getFingerprint(), event.fingerprint));
        }
        entry.addExecution(event);
    }

    Snapshot buildSnapshot(boolean finalSnapshot) {
        ServerInfo copy = server.copy();
        copy.setUniqueQueries(entries.size());
        copy.setLineCount(lineCounter.getAsLong());

        double elapsed = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        copy.setAnalysisDuration(elapsed);
        if (elapsed > 0) {
            copy.setLinesPerSecond(copy.getLineCount() / elapsed);
            copy.setQueriesPerSecond(copy.getQueryCount() / elapsed);
            copy.setBytesPerSecond(copy.getCumBytes() / elapsed);
        }

        List<QueryStatsEntry> queries = entries.values().stream()
                .map(QueryStatsEntry::copy)
                .collect(Collectors.toList());
        return new Snapshot(copy, queries, finalSnapshot);
    }

    public State getState() {
        return state;
    }
}
