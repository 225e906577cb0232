package com.querydigest.log.parser.accumulator;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Query time distribution of one fingerprint, derived from its samples at snapshot time.
 */
public final class DistributionStats {

    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    private final double stdDev;
    private final double p50;
    private final double p95;
    private final double concurrency;

    private DistributionStats(long count, double min, double max, double mean, double stdDev, double p50,
            double p95, double concurrency) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.stdDev = stdDev;
        this.p50 = p50;
        this.p95 = p95;
        this.concurrency = concurrency;
    }

    /**
     * @param captureSpanSeconds wall-clock span of the whole capture; concurrency is 0 when it is not positive
     */
    public static DistributionStats of(QueryStatsEntry entry, double captureSpanSeconds) {
        double[] sorted = entry.getQueryTimes();
        Arrays.sort(sorted);

        double concurrency = captureSpanSeconds > 0
                ? 100.0 * entry.getCumQueryTime() / captureSpanSeconds
                : 0.0;

        if (sorted.length == 0) {
            return new DistributionStats(0, 0, 0, 0, 0, 0, 0, concurrency);
        }

        // Values are added in sorted order so mean and variance do not depend on arrival order
        DescriptiveStatistics stats = new DescriptiveStatistics(sorted);
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(sorted);

        return new DistributionStats(
                sorted.length,
                sorted[0],
                sorted[sorted.length - 1],
                stats.getMean(),
                sorted.length > 1 ? stats.getStandardDeviation() : 0.0,
                percentile.evaluate(50),
                percentile.evaluate(95),
                concurrency);
    }

    public long getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getP50() {
        return p50;
    }

    public double getP95() {
        return p95;
    }

    /**
     * Percentage of the capture span spent executing this fingerprint; can exceed 100.
     */
    public double getConcurrency() {
        return concurrency;
    }
}
