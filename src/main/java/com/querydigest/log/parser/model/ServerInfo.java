package com.querydigest.log.parser.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Server identity read from the slow log preamble, plus global counters and throughput figures
 * filled in by the aggregator.
 */
public class ServerInfo {

    public static final String UNPARSABLE = "unable to parse line";

    private String binary;
    private String versionShort;
    private String version;
    private String versionDescription;
    private int tcpPort;
    private String unixSocket;

    private long cumBytes;
    private long queryCount;
    private int uniqueQueries;
    private long lineCount;
    private Instant start;
    private Instant end;

    private double analysisDuration;
    private double linesPerSecond;
    private double queriesPerSecond;
    private double bytesPerSecond;

    public ServerInfo() {
        // Default constructor
    }

    public ServerInfo(String binary, String versionShort, String version, String versionDescription,
            int tcpPort, String unixSocket) {
        this.binary = binary;
        this.versionShort = versionShort;
        this.version = version;
        this.versionDescription = versionDescription;
        this.tcpPort = tcpPort;
        this.unixSocket = unixSocket;
    }

    /**
     * Identity used when the preamble does not match the expected grammar.
     */
    public static ServerInfo unparsable() {
        return new ServerInfo(UNPARSABLE, UNPARSABLE, UNPARSABLE, UNPARSABLE, 0, UNPARSABLE);
    }

    public ServerInfo copy() {
        ServerInfo copy = new ServerInfo(binary, versionShort, version, versionDescription, tcpPort, unixSocket);
        copy.cumBytes = cumBytes;
        copy.queryCount = queryCount;
        copy.uniqueQueries = uniqueQueries;
        copy.lineCount = lineCount;
        copy.start = start;
        copy.end = end;
        copy.analysisDuration = analysisDuration;
        copy.linesPerSecond = linesPerSecond;
        copy.queriesPerSecond = queriesPerSecond;
        copy.bytesPerSecond = bytesPerSecond;
        return copy;
    }

    /**
     * Widens the observed capture window; comparison based so arrival order does not matter.
     */
    public void observe(Instant time) {
        if (time == null) {
            return;
        }
        if (start == null || time.isBefore(start)) {
            start = time;
        }
        if (end == null || time.isAfter(end)) {
            end = time;
        }
    }

    /**
     * Observed wall-clock span between the earliest and latest query, 0 when unknown.
     */
    public Duration getCaptureSpan() {
        if (start == null || end == null) {
            return Duration.ZERO;
        }
        return Duration.between(start, end);
    }

    public double getCaptureSpanSeconds() {
        Duration span = getCaptureSpan();
        return span.getSeconds() + span.getNano() / 1_000_000_000.0;
    }

    public double getQps() {
        double span = getCaptureSpanSeconds();
        return span > 0 ? queryCount / span : 0.0;
    }

    public String getBinary() {
        return binary;
    }

    public void setBinary(String binary) {
        this.binary = binary;
    }

    public String getVersionShort() {
        return versionShort;
    }

    public void setVersionShort(String versionShort) {
        this.versionShort = versionShort;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getVersionDescription() {
        return versionDescription;
    }

    public void setVersionDescription(String versionDescription) {
        this.versionDescription = versionDescription;
    }

    public int getTcpPort() {
        return tcpPort;
    }

    public void setTcpPort(int tcpPort) {
        this.tcpPort = tcpPort;
    }

    public String getUnixSocket() {
        return unixSocket;
    }

    public void setUnixSocket(String unixSocket) {
        this.unixSocket = unixSocket;
    }

    public long getCumBytes() {
        return cumBytes;
    }

    public void setCumBytes(long cumBytes) {
        this.cumBytes = cumBytes;
    }

    public void addBytes(long bytes) {
        this.cumBytes += bytes;
    }

    public long getQueryCount() {
        return queryCount;
    }

    public void setQueryCount(long queryCount) {
        this.queryCount = queryCount;
    }

    public void incrementQueryCount() {
        queryCount++;
    }

    public int getUniqueQueries() {
        return uniqueQueries;
    }

    public void setUniqueQueries(int uniqueQueries) {
        this.uniqueQueries = uniqueQueries;
    }

    public long getLineCount() {
        return lineCount;
    }

    public void setLineCount(long lineCount) {
        this.lineCount = lineCount;
    }

    public Instant getStart() {
        return start;
    }

    public void setStart(Instant start) {
        this.start = start;
    }

    public Instant getEnd() {
        return end;
    }

    public void setEnd(Instant end) {
        this.end = end;
    }

    public double getAnalysisDuration() {
        return analysisDuration;
    }

    public void setAnalysisDuration(double analysisDuration) {
        this.analysisDuration = analysisDuration;
    }

    public double getLinesPerSecond() {
        return linesPerSecond;
    }

    public void setLinesPerSecond(double linesPerSecond) {
        this.linesPerSecond = linesPerSecond;
    }

    public double getQueriesPerSecond() {
        return queriesPerSecond;
    }

    public void setQueriesPerSecond(double queriesPerSecond) {
        this.queriesPerSecond = queriesPerSecond;
    }

    public double getBytesPerSecond() {
        return bytesPerSecond;
    }

    public void setBytesPerSecond(double bytesPerSecond) {
        this.bytesPerSecond = bytesPerSecond;
    }

    @Override
    public int hashCode() {
        return Objects.hash(binary, versionShort, version, versionDescription, tcpPort, unixSocket, cumBytes,
                queryCount, uniqueQueries, lineCount, start, end, analysisDuration, linesPerSecond,
                queriesPerSecond, bytesPerSecond);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        ServerInfo other = (ServerInfo) obj;
        return tcpPort == other.tcpPort
                && cumBytes == other.cumBytes
                && queryCount == other.queryCount
                && uniqueQueries == other.uniqueQueries
                && lineCount == other.lineCount
                && Double.compare(analysisDuration, other.analysisDuration) == 0
                && Double.compare(linesPerSecond, other.linesPerSecond) == 0
                && Double.compare(queriesPerSecond, other.queriesPerSecond) == 0
                && Double.compare(bytesPerSecond, other.bytesPerSecond) == 0
                && Objects.equals(binary, other.binary)
                && Objects.equals(versionShort, other.versionShort)
                && Objects.equals(version, other.version)
                && Objects.equals(versionDescription, other.versionDescription)
                && Objects.equals(unixSocket, other.unixSocket)
                && Objects.equals(start, other.start)
                && Objects.equals(end, other.end);
    }

    @Override
    public String toString() {
        return String.format("%s %s (%s) port=%d socket=%s queries=%d bytes=%d", binary, version,
                versionDescription, tcpPort, unixSocket, queryCount, cumBytes);
    }
}
