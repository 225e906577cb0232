package com.querydigest.log.parser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.querydigest.log.parser.accumulator.QueryStatsEntry;
import com.querydigest.log.parser.accumulator.SortKey;

/**
 * Point-in-time copy of the aggregated statistics handed to renderers and to the cache.
 */
public class Snapshot {

    private final ServerInfo server;
    private final List<QueryStatsEntry> queries;
    private final boolean finalSnapshot;

    public Snapshot(ServerInfo server, List<QueryStatsEntry> queries, boolean finalSnapshot) {
        this.server = server;
        this.queries = Collections.unmodifiableList(new ArrayList<>(queries));
        this.finalSnapshot = finalSnapshot;
    }

    /**
     * Orders the entries by the given key, highest first unless {@code reverse} is set.
     */
    public Snapshot sorted(SortKey sortKey, boolean reverse) {
        Comparator<QueryStatsEntry> comparator = sortKey.comparator();
        if (!reverse) {
            comparator = comparator.reversed();
        }
        List<QueryStatsEntry> sorted = new ArrayList<>(queries);
        sorted.sort(comparator);
        return new Snapshot(server, sorted, finalSnapshot);
    }

    /**
     * Keeps at most {@code limit} entries; a negative limit keeps everything.
     */
    public Snapshot top(int limit) {
        if (limit < 0 || queries.size() <= limit) {
            return this;
        }
        return new Snapshot(server, queries.subList(0, limit), finalSnapshot);
    }

    public ServerInfo getServer() {
        return server;
    }

    public List<QueryStatsEntry> getQueries() {
        return queries;
    }

    public boolean isFinal() {
        return finalSnapshot;
    }
}
