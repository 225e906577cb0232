package com.querydigest.log.parser.cache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.querydigest.log.parser.accumulator.FingerprintKey;
import com.querydigest.log.parser.accumulator.QueryStatsEntry;
import com.querydigest.log.parser.model.ServerInfo;
import com.querydigest.log.parser.model.Snapshot;

/**
 * JSON form of a {@link Snapshot}, shared by the cache file and the JSON report.
 */
public final class SnapshotJson {

    static final ObjectMapper mapper = new ObjectMapper();

    private SnapshotJson() {
    }

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static ObjectNode toJson(Snapshot snapshot) {
        ObjectNode root = mapper.createObjectNode();
        root.set("server", serverToJson(snapshot.getServer()));

        ArrayNode queries = mapper.createArrayNode();
        for (QueryStatsEntry entry : snapshot.getQueries()) {
            queries.add(entryToJson(entry));
        }
        root.set("queries", queries);
        return root;
    }

    /**
     * Decodes a document produced by {@link #toJson(Snapshot)}. Cached snapshots are always final.
     *
     * @throws IllegalArgumentException if a required member is missing
     */
    public static Snapshot fromJson(JsonNode root) {
        JsonNode server = require(root, "server");
        JsonNode queries = require(root, "queries");
        if (!queries.isArray()) {
            throw new IllegalArgumentException("'queries' is not an array");
        }

        List<QueryStatsEntry> entries = new ArrayList<>();
        for (JsonNode query : queries) {
            entries.add(entryFromJson(query));
        }
        return new Snapshot(serverFromJson(server), entries, true);
    }

    private static ObjectNode serverToJson(ServerInfo server) {
        ObjectNode node = mapper.createObjectNode();
        node.put("binary", server.getBinary());
        node.put("versionShort", server.getVersionShort());
        node.put("version", server.getVersion());
        node.put("versionDescription", server.getVersionDescription());
        node.put("tcpPort", server.getTcpPort());
        node.put("unixSocket", server.getUnixSocket());
        node.put("cumBytes", server.getCumBytes());
        node.put("queryCount", server.getQueryCount());
        node.put("uniqueQueries", server.getUniqueQueries());
        node.put("lineCount", server.getLineCount());
        node.put("start", server.getStart() != null ? server.getStart().toString() : null);
        node.put("end", server.getEnd() != null ? server.getEnd().toString() : null);
        node.put("analysisDuration", server.getAnalysisDuration());
        node.put("linesPerSecond", server.getLinesPerSecond());
        node.put("queriesPerSecond", server.getQueriesPerSecond());
        node.put("bytesPerSecond", server.getBytesPerSecond());
        return node;
    }

    private static ServerInfo serverFromJson(JsonNode node) {
        ServerInfo server = new ServerInfo(
                text(node, "binary"),
                text(node, "versionShort"),
                text(node, "version"),
                text(node, "versionDescription"),
                node.path("tcpPort").asInt(),
                text(node, "unixSocket"));
        server.setCumBytes(node.path("cumBytes").asLong());
        server.setQueryCount(node.path("queryCount").asLong());
        server.setUniqueQueries(node.path("uniqueQueries").asInt());
        server.setLineCount(node.path("lineCount").asLong());
        server.setStart(instant(node, "start"));
        server.setEnd(instant(node, "end"));
        server.setAnalysisDuration(node.path("analysisDuration").asDouble());
        server.setLinesPerSecond(node.path("linesPerSecond").asDouble());
        server.setQueriesPerSecond(node.path("queriesPerSecond").asDouble());
        server.setBytesPerSecond(node.path("bytesPerSecond").asDouble());
        return server;
    }

    private static ObjectNode entryToJson(QueryStatsEntry entry) {
        ObjectNode node = mapper.createObjectNode();
        node.put("hash", entry.getKey().toHex());
        node.put("fingerprint", entry.getFingerprint());
        node.put("schema", entry.getSchema());
        node.put("count", entry.getCount());
        node.put("cumErrored", entry.getCumErrored());
        node.put("cumKilled", entry.getCumKilled());
        node.put("cumQueryTime", entry.getCumQueryTime());
        node.put("cumLockTime", entry.getCumLockTime());
        node.put("cumRowsSent", entry.getCumRowsSent());
        node.put("cumRowsExamined", entry.getCumRowsExamined());
        node.put("cumRowsAffected", entry.getCumRowsAffected());
        node.put("cumBytesSent", entry.getCumBytesSent());
        node.set("queryTime", toArray(entry.getQueryTimes()));
        node.set("bytesSent", toArray(entry.getBytesSent()));
        node.set("lockTime", toArray(entry.getLockTimes()));
        node.set("rowsSent", toArray(entry.getRowsSent()));
        node.set("rowsExamined", toArray(entry.getRowsExamined()));
        node.set("rowsAffected", toArray(entry.getRowsAffected()));
        return node;
    }

    private static QueryStatsEntry entryFromJson(JsonNode node) {
        String fingerprint = text(require(node, "fingerprint"), null);
        String hash = text(node, "hash");
        FingerprintKey key = hash != null ? FingerprintKey.fromHex(hash) : FingerprintKey.of(fingerprint);

        QueryStatsEntry entry = new QueryStatsEntry(key, fingerprint, text(node, "schema"));
        entry.restoreTotals(
                node.path("count").asLong(),
                node.path("cumErrored").asLong(),
                node.path("cumKilled").asLong(),
                node.path("cumQueryTime").asDouble(),
                node.path("cumLockTime").asDouble(),
                node.path("cumRowsSent").asLong(),
                node.path("cumRowsExamined").asLong(),
                node.path("cumRowsAffected").asLong(),
                node.path("cumBytesSent").asLong());
        entry.restoreSamples(
                fromArray(node.get("queryTime")),
                fromArray(node.get("bytesSent")),
                fromArray(node.get("lockTime")),
                fromArray(node.get("rowsSent")),
                fromArray(node.get("rowsExamined")),
                fromArray(node.get("rowsAffected")));
        return entry;
    }

    private static ArrayNode toArray(double[] values) {
        ArrayNode array = mapper.createArrayNode();
        for (double v : values) {
            array.add(v);
        }
        return array;
    }

    private static double[] fromArray(JsonNode node) {
        if (node == null || !node.isArray()) {
            return new double[0];
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = node.get(i).asDouble();
        }
        return values;
    }

    private static JsonNode require(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing '" + field + "' in snapshot document");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = field == null ? node : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        return value == null ? null : Instant.parse(value);
    }
}
