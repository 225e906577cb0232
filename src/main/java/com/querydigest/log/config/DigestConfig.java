package com.querydigest.log.config;

import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.parser.accumulator.SortKey;

/**
 * Settings consumed by the ingestion pipeline and the report.
 * Defaults can be overridden from a properties file, and then from the command line.
 */
public class DigestConfig {

    private static final Logger logger = LoggerFactory.getLogger(DigestConfig.class);

    public static final int DEFAULT_TOP = 20;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final long DEFAULT_FOLLOW_POLL_MS = 250;

    private int workers = Runtime.getRuntime().availableProcessors();
    private long refreshMillis = 0;
    private SortKey sortKey = SortKey.TIME;
    private boolean reverse = false;
    private int top = DEFAULT_TOP;
    private boolean cacheEnabled = true;
    private boolean follow = false;
    private boolean progress = false;
    private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
    private long followPollMillis = DEFAULT_FOLLOW_POLL_MS;
    private String output = "terminal";

    /**
     * Loads settings from properties. Supported keys:
     * - digest.workers: number of parser threads
     * - digest.refresh.ms: interval of partial reports, 0 disables them
     * - digest.sort / digest.reverse: sort key and direction
     * - digest.top: entries shown
     * - digest.cache: enable the result cache
     * - digest.output: report format
     * - digest.queue.capacity: capacity of the block and event queues
     * - digest.follow.poll.ms: poll interval when following a file
     */
    public void loadFromProperties(Properties props) {
        workers = getInt(props, "digest.workers", workers);
        refreshMillis = getLong(props, "digest.refresh.ms", refreshMillis);
        String sort = props.getProperty("digest.sort");
        if (sort != null && !sort.trim().isEmpty()) {
            sortKey = SortKey.parse(sort);
        }
        reverse = getBoolean(props, "digest.reverse", reverse);
        top = getInt(props, "digest.top", top);
        cacheEnabled = getBoolean(props, "digest.cache", cacheEnabled);
        String out = props.getProperty("digest.output");
        if (out != null && !out.trim().isEmpty()) {
            output = out.trim();
        }
        queueCapacity = getInt(props, "digest.queue.capacity", queueCapacity);
        followPollMillis = getLong(props, "digest.follow.poll.ms", followPollMillis);
    }

    private static int getInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static long getLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static boolean getBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        this.workers = workers;
    }

    public long getRefreshMillis() {
        return refreshMillis;
    }

    public void setRefreshMillis(long refreshMillis) {
        this.refreshMillis = refreshMillis;
    }

    public SortKey getSortKey() {
        return sortKey;
    }

    public void setSortKey(SortKey sortKey) {
        this.sortKey = sortKey;
    }

    public boolean isReverse() {
        return reverse;
    }

    public void setReverse(boolean reverse) {
        this.reverse = reverse;
    }

    public int getTop() {
        return top;
    }

    public void setTop(int top) {
        this.top = top;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public boolean isFollow() {
        return follow;
    }

    public void setFollow(boolean follow) {
        this.follow = follow;
    }

    public boolean isProgress() {
        return progress;
    }

    public void setProgress(boolean progress) {
        this.progress = progress;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getFollowPollMillis() {
        return followPollMillis;
    }

    public void setFollowPollMillis(long followPollMillis) {
        this.followPollMillis = followPollMillis;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }
}
