package com.querydigest.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.querydigest.log.parser.model.QueryEvent;
import com.querydigest.log.parser.model.RawRecordBlock;

public class SlowLogRecordParserTest {

    private final SlowLogRecordParser parser = new SlowLogRecordParser();

    private static RawRecordBlock block(String... lines) {
        RawRecordBlock block = new RawRecordBlock(1, 16);
        for (String line : lines) {
            assertTrue(block.add(line));
        }
        return block;
    }

    @Test
    public void testMySql57Record() {
        Optional<QueryEvent> result = parser.parse(block(
                "# Time: 2018-12-17T15:18:58.744913Z",
                "# User@Host: agency[agency] @  [192.168.0.102]  Id: 3502988",
                "# Schema: taskl-production  Last_errno: 0  Killed: 0",
                "# Query_time: 0.000030  Lock_time: 0.000010  Rows_sent: 2  Rows_examined: 7  Rows_affected: 1",
                "# Bytes_sent: 561",
                "SET timestamp=1545059938;",
                "SELECT * FROM users WHERE id=42;"));

        assertTrue(result.isPresent());
        QueryEvent event = result.get();
        assertEquals(Instant.parse("2018-12-17T15:18:58.744913Z"), event.time);
        assertEquals("agency", event.user);
        assertEquals("agency", event.altUser);
        assertEquals("192.168.0.102", event.client);
        assertEquals(3502988L, event.connectionId);
        assertEquals("taskl-production", event.schema);
        assertEquals(0, event.lastErrno);
        assertEquals(0, event.killed);
        assertEquals(0.000030, event.queryTime, 1e-12);
        assertEquals(0.000010, event.lockTime, 1e-12);
        assertEquals(2, event.rowsSent);
        assertEquals(7, event.rowsExamined);
        assertEquals(1, event.rowsAffected);
        assertEquals(561, event.bytesSent);
        assertEquals("SELECT * FROM users WHERE id=42;", event.fullQuery);
        assertEquals("select * from users where id = ?;", event.fingerprint);
        assertEquals(Fingerprinter.key(event.fingerprint), event.key);
    }

    @Test
    public void testMariaDbRecord() {
        Optional<QueryEvent> result = parser.parse(block(
                "# Time: 181217 15:18:58",
                "# User@Host: app[app] @ localhost []",
                "# Thread_id: 12  Schema: blog  QC_hit: No",
                "# Query_time: 0.002000  Lock_time: 0.000050  Rows_sent: 5  Rows_examined: 100",
                "# Rows_affected: 3  Bytes_sent: 1024",
                "use blog;",
                "SELECT title FROM posts WHERE author_id=3 LIMIT 5;"));

        assertTrue(result.isPresent());
        QueryEvent event = result.get();
        assertEquals(Instant.parse("2018-12-17T15:18:58Z"), event.time);
        assertEquals("app", event.user);
        assertEquals("localhost", event.client);
        assertEquals(12L, event.connectionId);
        assertEquals("blog", event.schema);
        assertEquals(0.002, event.queryTime, 1e-12);
        assertEquals(5, event.rowsSent);
        assertEquals(100, event.rowsExamined);
        assertEquals(3, event.rowsAffected);
        assertEquals(1024, event.bytesSent);
        assertEquals("select title from posts where author_id = ? limit 5;", event.fingerprint);
    }

    @Test
    public void testErrorAndKilledCounters() {
        QueryEvent event = parser.parse(block(
                "# Time: 2018-12-17T15:18:58Z",
                "# Schema: shop  Last_errno: 1062  Killed: 1",
                "INSERT INTO t VALUES (1);")).get();

        assertEquals(1062, event.lastErrno);
        assertEquals(1, event.killed);
        assertEquals("insert into t values (?)", event.fingerprint);
    }

    @Test
    public void testLastStatementWins() {
        QueryEvent event = parser.parse(block(
                "# Time: 2018-12-17T15:18:58Z",
                "SELECT 1;",
                "SELECT * FROM b;")).get();

        assertEquals("SELECT * FROM b;", event.fullQuery);
    }

    @Test
    public void testNoStatementIsDropped() {
        assertFalse(parser.parse(block(
                "# Time: 2018-12-17T15:18:58Z",
                "# User@Host: agency[agency] @  [192.168.0.102]  Id: 3502988",
                "SET timestamp=1545059938;",
                "# administrator command: Quit;")).isPresent());
    }

    @Test
    public void testMalformedAnnotationsAreRecoverable() {
        QueryEvent event = parser.parse(block(
                "# Time: yesterday at noon",
                "# User@Host: garbage",
                "# Query_time: fast",
                "# Bytes_sent: many",
                "# Some_future_field: 12",
                "SELECT 1;")).get();

        assertNull(event.time);
        assertNull(event.user);
        assertEquals(0.0, event.queryTime);
        assertEquals(0, event.bytesSent);
        assertEquals("select 1;", event.fingerprint);
    }

    @Test
    public void testParseTime() {
        assertEquals(Instant.parse("2018-12-17T15:18:58.744913Z"),
                SlowLogRecordParser.parseTime("# Time: 2018-12-17T15:18:58.744913Z", 1));
        assertEquals(Instant.parse("2018-12-17T14:18:58Z"),
                SlowLogRecordParser.parseTime("# Time: 2018-12-17T15:18:58+01:00", 1));
        assertEquals(Instant.parse("2018-12-17T05:18:58Z"),
                SlowLogRecordParser.parseTime("# Time: 181217  5:18:58", 1));
        assertNull(SlowLogRecordParser.parseTime("# Time", 1));
        assertNull(SlowLogRecordParser.parseTime("# Time: not a time", 1));
    }
}
