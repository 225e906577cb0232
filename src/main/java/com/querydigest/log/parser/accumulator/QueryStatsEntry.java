package com.querydigest.log.parser.accumulator;

import java.util.Arrays;
import java.util.Objects;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.querydigest.log.parser.model.QueryEvent;

/**
 * Per-fingerprint accumulator: cumulative sums plus one sample per occurrence for each metric.
 * Only the aggregator thread mutates an entry; snapshots get copies.
 */
public class QueryStatsEntry {

    private static final double MICROS_PER_SECOND = 1_000_000.0;

    private final FingerprintKey key;
    private final String fingerprint;
    private String schema;

    private long count;
    private long cumErrored;
    private long cumKilled;
    // Times are summed in whole microseconds so totals do not depend on arrival order
    private long cumQueryTimeMicros;
    private long cumLockTimeMicros;
    private long cumRowsSent;
    private long cumRowsExamined;
    private long cumRowsAffected;
    private long cumBytesSent;

    private final DescriptiveStatistics queryTimes;
    private final DescriptiveStatistics bytesSent;
    private final DescriptiveStatistics lockTimes;
    private final DescriptiveStatistics rowsSent;
    private final DescriptiveStatistics rowsExamined;
    private final DescriptiveStatistics rowsAffected;

    public QueryStatsEntry(FingerprintKey key, String fingerprint, String schema) {
        this.key = key;
        this.fingerprint = fingerprint;
        this.schema = schema;
        this.queryTimes = new DescriptiveStatistics();
        this.bytesSent = new DescriptiveStatistics();
        this.lockTimes = new DescriptiveStatistics();
        this.rowsSent = new DescriptiveStatistics();
        this.rowsExamined = new DescriptiveStatistics();
        this.rowsAffected = new DescriptiveStatistics();
    }

    private QueryStatsEntry(QueryStatsEntry other) {
        this.key = other.key;
        this.fingerprint = other.fingerprint;
        this.schema = other.schema;
        this.count = other.count;
        this.cumErrored = other.cumErrored;
        this.cumKilled = other.cumKilled;
        this.cumQueryTimeMicros = other.cumQueryTimeMicros;
        this.cumLockTimeMicros = other.cumLockTimeMicros;
        this.cumRowsSent = other.cumRowsSent;
        this.cumRowsExamined = other.cumRowsExamined;
        this.cumRowsAffected = other.cumRowsAffected;
        this.cumBytesSent = other.cumBytesSent;
        this.queryTimes = new DescriptiveStatistics(other.queryTimes);
        this.bytesSent = new DescriptiveStatistics(other.bytesSent);
        this.lockTimes = new DescriptiveStatistics(other.lockTimes);
        this.rowsSent = new DescriptiveStatistics(other.rowsSent);
        this.rowsExamined = new DescriptiveStatistics(other.rowsExamined);
        this.rowsAffected = new DescriptiveStatistics(other.rowsAffected);
    }

    public void addExecution(QueryEvent event) {
        if (schema == null && event.schema != null) {
            schema = event.schema;
        }
        count++;
        if (event.lastErrno != 0) {
            cumErrored++;
        }
        cumKilled += event.killed;
        cumQueryTimeMicros += toMicros(event.queryTime);
        cumLockTimeMicros += toMicros(event.lockTime);
        cumRowsSent += event.rowsSent;
        cumRowsExamined += event.rowsExamined;
        cumRowsAffected += event.rowsAffected;
        cumBytesSent += event.bytesSent;

        queryTimes.addValue(event.queryTime);
        bytesSent.addValue(event.bytesSent);
        lockTimes.addValue(event.lockTime);
        rowsSent.addValue(event.rowsSent);
        rowsExamined.addValue(event.rowsExamined);
        rowsAffected.addValue(event.rowsAffected);
    }

    /**
     * Restores cumulative values read back from a cache file.
     */
    public void restoreTotals(long count, long cumErrored, long cumKilled, double cumQueryTime, double cumLockTime,
            long cumRowsSent, long cumRowsExamined, long cumRowsAffected, long cumBytesSent) {
        this.count = count;
        this.cumErrored = cumErrored;
        this.cumKilled = cumKilled;
        this.cumQueryTimeMicros = toMicros(cumQueryTime);
        this.cumLockTimeMicros = toMicros(cumLockTime);
        this.cumRowsSent = cumRowsSent;
        this.cumRowsExamined = cumRowsExamined;
        this.cumRowsAffected = cumRowsAffected;
        this.cumBytesSent = cumBytesSent;
    }

    /**
     * Restores the per-occurrence samples read back from a cache file.
     */
    public void restoreSamples(double[] queryTimes, double[] bytesSent, double[] lockTimes, double[] rowsSent,
            double[] rowsExamined, double[] rowsAffected) {
        addAll(this.queryTimes, queryTimes);
        addAll(this.bytesSent, bytesSent);
        addAll(this.lockTimes, lockTimes);
        addAll(this.rowsSent, rowsSent);
        addAll(this.rowsExamined, rowsExamined);
        addAll(this.rowsAffected, rowsAffected);
    }

    private static void addAll(DescriptiveStatistics target, double[] values) {
        if (values == null) {
            return;
        }
        for (double v : values) {
            target.addValue(v);
        }
    }

    private static long toMicros(double seconds) {
        return Math.round(seconds * MICROS_PER_SECOND);
    }

    public QueryStatsEntry copy() {
        return new QueryStatsEntry(this);
    }

    public FingerprintKey getKey() {
        return key;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getSchema() {
        return schema;
    }

    public long getCount() {
        return count;
    }

    public long getCumErrored() {
        return cumErrored;
    }

    public long getCumKilled() {
        return cumKilled;
    }

    public double getCumQueryTime() {
        return cumQueryTimeMicros / MICROS_PER_SECOND;
    }

    public double getCumLockTime() {
        return cumLockTimeMicros / MICROS_PER_SECOND;
    }

    public long getCumRowsSent() {
        return cumRowsSent;
    }

    public long getCumRowsExamined() {
        return cumRowsExamined;
    }

    public long getCumRowsAffected() {
        return cumRowsAffected;
    }

    public long getCumBytesSent() {
        return cumBytesSent;
    }

    public double[] getQueryTimes() {
        return queryTimes.getValues();
    }

    public double[] getBytesSent() {
        return bytesSent.getValues();
    }

    public double[] getLockTimes() {
        return lockTimes.getValues();
    }

    public double[] getRowsSent() {
        return rowsSent.getValues();
    }

    public double[] getRowsExamined() {
        return rowsExamined.getValues();
    }

    public double[] getRowsAffected() {
        return rowsAffected.getValues();
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, fingerprint, count);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        QueryStatsEntry other = (QueryStatsEntry) obj;
        return count == other.count
                && cumErrored == other.cumErrored
                && cumKilled == other.cumKilled
                && cumQueryTimeMicros == other.cumQueryTimeMicros
                && cumLockTimeMicros == other.cumLockTimeMicros
                && cumRowsSent == other.cumRowsSent
                && cumRowsExamined == other.cumRowsExamined
                && cumRowsAffected == other.cumRowsAffected
                && cumBytesSent == other.cumBytesSent
                && Objects.equals(key, other.key)
                && Objects.equals(fingerprint, other.fingerprint)
                && Objects.equals(schema, other.schema)
                && Arrays.equals(getQueryTimes(), other.getQueryTimes())
                && Arrays.equals(getBytesSent(), other.getBytesSent())
                && Arrays.equals(getLockTimes(), other.getLockTimes())
                && Arrays.equals(getRowsSent(), other.getRowsSent())
                && Arrays.equals(getRowsExamined(), other.getRowsExamined())
                && Arrays.equals(getRowsAffected(), other.getRowsAffected());
    }

    @Override
    public String toString() {
        return String.format("%s %-60s %10d %12.6f", key.toShortHex(), fingerprint, count, getCumQueryTime());
    }
}
