package com.querydigest.log.parser.model;

import java.time.Instant;

import com.querydigest.log.parser.accumulator.FingerprintKey;

/**
 * One parsed slow query occurrence.
 */
public class QueryEvent {

    /** Marker closing the event queue once every worker has exited. */
    public static final QueryEvent END_OF_STREAM = new QueryEvent();

    public Instant time = null;
    public String user = null;
    public String altUser = null;
    public String client = null;
    public long connectionId;
    public String schema = null;
    public int lastErrno;
    public int killed;
    public double queryTime;
    public double lockTime;
    public long rowsSent;
    public long rowsExamined;
    public long rowsAffected;
    public long bytesSent;
    public String fullQuery = null;
    public String fingerprint = null;
    public FingerprintKey key = null;

    public boolean hasFingerprint() {
        return fingerprint != null && !fingerprint.isEmpty();
    }
}
