package com.querydigest.log.parser.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.querydigest.log.parser.Fingerprinter;
import com.querydigest.log.parser.accumulator.QueryStatsEntry;
import com.querydigest.log.parser.model.QueryEvent;
import com.querydigest.log.parser.model.ServerInfo;
import com.querydigest.log.parser.model.Snapshot;

public class SnapshotCacheTest {

    @TempDir
    Path tempDir;

    private Path source;

    @BeforeEach
    public void setUp() throws IOException {
        source = tempDir.resolve("slow.log");
        Files.writeString(source, "# Time: 2018-12-17T15:18:58Z\nSELECT 1;\n");
    }

    private static QueryStatsEntry entry(String fingerprint, String schema, double... queryTimes) {
        QueryStatsEntry entry = new QueryStatsEntry(Fingerprinter.key(fingerprint), fingerprint, schema);
        for (double queryTime : queryTimes) {
            QueryEvent event = new QueryEvent();
            event.fingerprint = fingerprint;
            event.queryTime = queryTime;
            event.lockTime = queryTime / 3;
            event.rowsSent = 2;
            event.rowsExamined = 17;
            event.rowsAffected = 1;
            event.bytesSent = 333;
            event.lastErrno = queryTimes.length > 1 ? 0 : 1146;
            entry.addExecution(event);
        }
        return entry;
    }

    private static Snapshot snapshot() {
        ServerInfo server = new ServerInfo("/usr/sbin/mysqld", "5.7.24", "5.7.24-log",
                "MySQL Community Server (GPL)", 3306, "/var/run/mysqld/mysqld.sock");
        server.observe(Instant.parse("2018-12-17T15:18:58.744913Z"));
        server.observe(Instant.parse("2018-12-17T15:28:58Z"));
        server.setQueryCount(4);
        server.setCumBytes(1332);
        server.setUniqueQueries(2);
        server.setLineCount(40);
        server.setAnalysisDuration(0.125);
        server.setLinesPerSecond(320);
        server.setQueriesPerSecond(32);
        server.setBytesPerSecond(10656);
        return new Snapshot(server, List.of(
                entry("select * from users where id = ?", "shop", 0.000300, 0.1, 1.7),
                entry("update orders set status = ?", null, 2.5)), true);
    }

    @Test
    public void testCachePath() {
        assertEquals(tempDir.resolve("slow.log.cache"), SnapshotCache.cachePathFor(source));
        assertEquals(tempDir.resolve("slow.log.cache"), new SnapshotCache(source).getCacheFile());
    }

    @Test
    public void testWriteThenRead() throws Exception {
        Snapshot original = snapshot();
        SnapshotCache cache = new SnapshotCache(source);
        cache.write(original);
        assertTrue(Files.exists(cache.getCacheFile()));

        Optional<Snapshot> restored = cache.read();
        assertTrue(restored.isPresent());
        assertTrue(restored.get().isFinal());
        assertEquals(original.getServer(), restored.get().getServer());
        assertEquals(original.getQueries(), restored.get().getQueries());
    }

    @Test
    public void testMissingCache() {
        assertFalse(new SnapshotCache(source).read().isPresent());
    }

    @Test
    public void testMissingSource() throws Exception {
        SnapshotCache cache = new SnapshotCache(source);
        cache.write(snapshot());
        Files.delete(source);
        assertFalse(cache.read().isPresent());
    }

    @Test
    public void testStaleCacheIgnored() throws Exception {
        SnapshotCache cache = new SnapshotCache(source);
        cache.write(snapshot());

        Instant now = Instant.now();
        Files.setLastModifiedTime(cache.getCacheFile(), FileTime.from(now.minusSeconds(60)));
        Files.setLastModifiedTime(source, FileTime.from(now));
        assertFalse(cache.read().isPresent());

        Files.setLastModifiedTime(cache.getCacheFile(), FileTime.from(now.plusSeconds(60)));
        assertTrue(cache.read().isPresent());
    }

    @Test
    public void testIsStale() {
        FileTime older = FileTime.fromMillis(1_000);
        FileTime newer = FileTime.fromMillis(2_000);
        assertTrue(SnapshotCache.isStale(newer, older));
        assertFalse(SnapshotCache.isStale(older, newer));
        assertFalse(SnapshotCache.isStale(older, older));
    }

    @Test
    public void testCorruptCacheIgnored() throws Exception {
        SnapshotCache cache = new SnapshotCache(source);
        Files.writeString(cache.getCacheFile(), "{\"server\": {\"binary\": ");
        assertFalse(cache.read().isPresent());

        Files.writeString(cache.getCacheFile(), "{\"unrelated\": true}");
        assertFalse(cache.read().isPresent());

        Files.writeString(cache.getCacheFile(), "");
        assertFalse(cache.read().isPresent());
    }

    @Test
    public void testWriteFailure() throws Exception {
        Path directory = tempDir.resolve("logs");
        Files.createDirectories(directory.resolve("slow.log.cache"));
        SnapshotCache cache = new SnapshotCache(directory.resolve("slow.log"));

        SnapshotCacheException e = assertThrows(SnapshotCacheException.class, () -> cache.write(snapshot()));
        assertNotNull(e.getCause());
    }
}
