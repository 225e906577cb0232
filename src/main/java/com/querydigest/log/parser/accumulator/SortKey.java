package com.querydigest.log.parser.accumulator;

import java.util.Comparator;
import java.util.Locale;

/**
 * Keys the report can be ordered by.
 */
public enum SortKey {

    TIME(Comparator.comparingDouble(QueryStatsEntry::getCumQueryTime)),
    COUNT(Comparator.comparingLong(QueryStatsEntry::getCount)),
    BYTES(Comparator.comparingLong(QueryStatsEntry::getCumBytesSent)),
    LOCK(Comparator.comparingDouble(QueryStatsEntry::getCumLockTime)),
    SENT(Comparator.comparingLong(QueryStatsEntry::getCumRowsSent)),
    EXAMINED(Comparator.comparingLong(QueryStatsEntry::getCumRowsExamined)),
    AFFECTED(Comparator.comparingLong(QueryStatsEntry::getCumRowsAffected));

    private final Comparator<QueryStatsEntry> comparator;

    SortKey(Comparator<QueryStatsEntry> comparator) {
        this.comparator = comparator;
    }

    /**
     * Ascending comparator on this key.
     */
    public Comparator<QueryStatsEntry> comparator() {
        return comparator;
    }

    /**
     * Resolves a user supplied key, accepting the long aliases ({@code locktime}, {@code rowssent}, ...).
     * Unknown keys fall back to {@link #TIME}.
     */
    public static SortKey parse(String name) {
        if (name == null) {
            return TIME;
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "COUNT":
                return COUNT;
            case "BYTES":
                return BYTES;
            case "LOCK":
            case "LOCKTIME":
                return LOCK;
            case "SENT":
            case "ROWSSENT":
                return SENT;
            case "EXAMINED":
            case "ROWSEXAMINED":
                return EXAMINED;
            case "AFFECTED":
            case "ROWSAFFECTED":
                return AFFECTED;
            default:
                return TIME;
        }
    }
}
