package com.querydigest.log.parser.report;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import com.querydigest.log.parser.accumulator.DistributionStats;
import com.querydigest.log.parser.accumulator.QueryStatsEntry;
import com.querydigest.log.parser.model.ServerInfo;
import com.querydigest.log.parser.model.Snapshot;

/**
 * Multi-section human readable report.
 */
final class TerminalReport {

    private TerminalReport() {
    }

    static void render(Snapshot snapshot, PrintStream w) {
        ServerInfo server = snapshot.getServer();
        double span = server.getCaptureSpanSeconds();

        w.printf("%n# Server Info%n%n");
        w.printf("  Binary             : %s%n", server.getBinary());
        w.printf("  VersionShort       : %s%n", server.getVersionShort());
        w.printf("  Version            : %s%n", server.getVersion());
        w.printf("  VersionDescription : %s%n", server.getVersionDescription());
        w.printf("  TCPPort            : %d%n", server.getTcpPort());
        w.printf("  UnixSocket         : %s%n", server.getUnixSocket());

        w.printf("%n# Internal Analyzer Statistics%n%n");
        w.printf(Locale.ROOT, "  Duration  : %14.3fs%n", server.getAnalysisDuration());
        w.printf(Locale.ROOT, "  Log lines : %14.3fM (%d)%n", server.getLineCount() / 1_000_000.0, server.getLineCount());
        w.printf(Locale.ROOT, "  Lines/s   : %14.3f%n", server.getLinesPerSecond());
        w.printf(Locale.ROOT, "  Bytes/s   : %14.3f%n", server.getBytesPerSecond());
        w.printf(Locale.ROOT, "  Queries/s : %14.3f%n", server.getQueriesPerSecond());

        w.printf("%n# Global Statistics%n%n");
        w.printf(Locale.ROOT, "  Total queries      : %.3fM (%d)%n", server.getQueryCount() / 1_000_000.0, server.getQueryCount());
        w.printf(Locale.ROOT, "  Total bytes        : %.3fM (%d)%n", server.getCumBytes() / 1_000_000.0, server.getCumBytes());
        w.printf("  Total fingerprints : %d%n", server.getUniqueQueries());
        w.printf("  Capture start      : %s%n", server.getStart());
        w.printf("  Capture end        : %s%n", server.getEnd());
        w.printf("  Duration           : %s (%d s)%n", DurationFormat.format(span), server.getCaptureSpan().getSeconds());
        w.printf(Locale.ROOT, "  QPS                : %.0f%n", server.getQps());

        w.printf("%n# Queries%n");

        List<QueryStatsEntry> queries = snapshot.getQueries();
        for (int i = 0; i < queries.size(); i++) {
            QueryStatsEntry q = queries.get(i);
            DistributionStats d = DistributionStats.of(q, span);

            w.printf("%n# Query #%d: %s%n%n", i + 1, q.getKey().toShortHex());
            w.printf("  Fingerprint     : %s%n", q.getFingerprint());
            w.printf("  Schema          : %s%n", q.getSchema());
            w.printf("  Calls           : %d%n", q.getCount());
            w.printf("  CumErrored      : %d%n", q.getCumErrored());
            w.printf("  CumKilled       : %d%n", q.getCumKilled());
            w.printf("  CumQueryTime    : %s%n", DurationFormat.format(q.getCumQueryTime()));
            w.printf("  CumLockTime     : %s%n", DurationFormat.format(q.getCumLockTime()));
            w.printf("  CumRowsSent     : %d%n", q.getCumRowsSent());
            w.printf("  CumRowsExamined : %d%n", q.getCumRowsExamined());
            w.printf("  CumRowsAffected : %d%n", q.getCumRowsAffected());
            w.printf("  CumBytesSent    : %d%n", q.getCumBytesSent());
            w.printf(Locale.ROOT, "  Concurrency     : %2.2f%%%n", d.getConcurrency());
            w.printf("  min / max time  : %s / %s%n", DurationFormat.format(d.getMin()), DurationFormat.format(d.getMax()));
            w.printf("  mean time       : %s%n", DurationFormat.format(d.getMean()));
            w.printf("  p50 time        : %s%n", DurationFormat.format(d.getP50()));
            w.printf("  p95 time        : %s%n", DurationFormat.format(d.getP95()));
            w.printf("  stddev time     : %s%n", DurationFormat.format(d.getStdDev()));
        }
    }
}
