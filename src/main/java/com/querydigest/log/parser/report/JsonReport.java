package com.querydigest.log.parser.report;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.querydigest.log.parser.accumulator.DistributionStats;
import com.querydigest.log.parser.accumulator.QueryStatsEntry;
import com.querydigest.log.parser.cache.SnapshotJson;
import com.querydigest.log.parser.model.Snapshot;

/**
 * Snapshot as pretty printed JSON: the cache document plus the derived distribution of each query.
 */
final class JsonReport {

    private JsonReport() {
    }

    static void render(Snapshot snapshot, PrintStream out) {
        ObjectNode report = SnapshotJson.toJson(snapshot);
        double span = snapshot.getServer().getCaptureSpanSeconds();

        ArrayNode queries = (ArrayNode) report.get("queries");
        for (int i = 0; i < queries.size(); i++) {
            QueryStatsEntry entry = snapshot.getQueries().get(i);
            DistributionStats d = DistributionStats.of(entry, span);
            ObjectNode stats = SnapshotJson.mapper().createObjectNode();
            stats.put("min", d.getMin());
            stats.put("max", d.getMax());
            stats.put("mean", d.getMean());
            stats.put("p50", d.getP50());
            stats.put("p95", d.getP95());
            stats.put("stdDev", d.getStdDev());
            stats.put("concurrency", d.getConcurrency());
            ((ObjectNode) queries.get(i)).set("queryTimeStats", stats);
        }

        try {
            out.println(SnapshotJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } catch (IOException e) {
            throw new UncheckedIOException("unable to render JSON report", e);
        }
    }
}
