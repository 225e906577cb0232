package com.querydigest.log.parser.report;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import com.querydigest.log.parser.accumulator.DistributionStats;
import com.querydigest.log.parser.accumulator.QueryStatsEntry;
import com.querydigest.log.parser.model.ServerInfo;
import com.querydigest.log.parser.model.Snapshot;

/**
 * One line per fingerprint, fields separated by ';', for grep/awk/cut.
 */
final class GreppableReport {

    private GreppableReport() {
    }

    static void render(Snapshot snapshot, PrintStream w) {
        ServerInfo server = snapshot.getServer();
        double span = server.getCaptureSpanSeconds();

        w.printf("# Binary:%s;", server.getBinary());
        w.printf("VersionShort:%s;", server.getVersionShort());
        w.printf("Version:%s;", server.getVersion());
        w.printf("VersionDescription:%s;", server.getVersionDescription());
        w.printf("TCPPort:%d;", server.getTcpPort());
        w.printf("UnixSocket:%s;", server.getUnixSocket());
        w.printf(Locale.ROOT, "Total queries:%.3fM (%d);", server.getQueryCount() / 1_000_000.0, server.getQueryCount());
        w.printf(Locale.ROOT, "Total bytes:%.3fM (%d);", server.getCumBytes() / 1_000_000.0, server.getCumBytes());
        w.printf("Total fingerprints:%d;", server.getUniqueQueries());
        w.printf("Capture start:%s;", server.getStart());
        w.printf("Capture end:%s;", server.getEnd());
        w.printf("Duration:%s (%d s);", DurationFormat.format(span), server.getCaptureSpan().getSeconds());
        w.printf(Locale.ROOT, "QPS:%.0f%n", server.getQps());

        w.print("# 1_Pos;2_QueryID;3_Fingerprint;4_Schema;5_Calls;");
        w.print("6_CumErrored;7_CumKilled;8_CumQueryTime(s);9_CumLockTime(s);10_CumRowsSent;");
        w.print("11_CumRowsExamined;12_CumRowsAffected;13_CumBytesSent;14_Concurrency(%);15_Min(s);16_Max(s);");
        w.print("17_Mean(s);18_P50(s);19_P95(s);20_StdDev(s)");
        w.println();

        List<QueryStatsEntry> queries = snapshot.getQueries();
        for (int i = 0; i < queries.size(); i++) {
            QueryStatsEntry q = queries.get(i);
            DistributionStats d = DistributionStats.of(q, span);
            String fingerprint = q.getFingerprint().endsWith(";") ? q.getFingerprint() : q.getFingerprint() + ";";

            w.printf(Locale.ROOT, "%d;%s;%s%s;%d;", i + 1, q.getKey().toShortHex(), fingerprint, q.getSchema(),
                    q.getCount());
            w.printf(Locale.ROOT, "%d;%d;%f;%f;%d;", q.getCumErrored(), q.getCumKilled(), q.getCumQueryTime(),
                    q.getCumLockTime(), q.getCumRowsSent());
            w.printf(Locale.ROOT, "%d;%d;%d;%2.2f%%;%f;%f;", q.getCumRowsExamined(), q.getCumRowsAffected(),
                    q.getCumBytesSent(), d.getConcurrency(), d.getMin(), d.getMax());
            w.printf(Locale.ROOT, "%f;%f;%f;%f%n", d.getMean(), d.getP50(), d.getP95(), d.getStdDev());
        }
    }
}
