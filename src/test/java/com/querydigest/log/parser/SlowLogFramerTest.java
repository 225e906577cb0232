package com.querydigest.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;

import org.junit.jupiter.api.Test;

import com.querydigest.log.parser.model.RawRecordBlock;
import com.querydigest.log.parser.model.ServerInfo;

public class SlowLogFramerTest {

    private static final String PREAMBLE =
            "/usr/sbin/mysqld, Version: 5.7.24-log (MySQL Community Server (GPL)). started with:\n"
            + "Tcp port: 3306  Unix socket: /var/run/mysqld/mysqld.sock\n"
            + "Time                 Id Command    Argument\n";

    private final LinkedBlockingQueue<RawRecordBlock> blocks = new LinkedBlockingQueue<>();

    private SlowLogFramer framer(String log) {
        return new SlowLogFramer(new BufferedReader(new StringReader(log)), blocks);
    }

    private List<RawRecordBlock> drain() {
        List<RawRecordBlock> result = new ArrayList<>();
        blocks.drainTo(result);
        return result;
    }

    @Test
    public void testPreamble() throws Exception {
        ServerInfo info = framer(PREAMBLE).readPreamble();

        assertEquals("/usr/sbin/mysqld", info.getBinary());
        assertEquals("5.7.24", info.getVersionShort());
        assertEquals("5.7.24-log", info.getVersion());
        assertEquals("MySQL Community Server (GPL)", info.getVersionDescription());
        assertEquals(3306, info.getTcpPort());
        assertEquals("/var/run/mysqld/mysqld.sock", info.getUnixSocket());
    }

    @Test
    public void testUnparsablePreamble() {
        ServerInfo info = SlowLogFramer.parseServerInfo("hello world", "Tcp port: 3306");
        assertEquals(ServerInfo.UNPARSABLE, info.getBinary());
        assertEquals(ServerInfo.UNPARSABLE, info.getVersion());
        assertEquals(0, info.getTcpPort());

        assertEquals(ServerInfo.UNPARSABLE, SlowLogFramer.parseServerInfo(null, null).getBinary());
    }

    @Test
    public void testMissingBoundary() throws Exception {
        SlowLogFramer framer = framer(PREAMBLE + "SELECT 1;\nSELECT 2;\n");
        framer.readPreamble();
        SlowLogFormatException e = assertThrows(SlowLogFormatException.class, framer::call);
        assertTrue(e.getMessage().contains("# Time"));
        assertTrue(blocks.isEmpty());
    }

    @Test
    public void testEmptyInput() {
        assertThrows(SlowLogFormatException.class, framer("")::call);
    }

    @Test
    public void testFramesOneBlockPerBoundary() throws Exception {
        String log = PREAMBLE
                + "# Time: 2018-12-17T15:18:58.744913Z\n"
                + "# Query_time: 0.1  Lock_time: 0.0  Rows_sent: 0  Rows_examined: 0\n"
                + "SELECT 1;\n"
                + "# Time: 2018-12-17T15:18:59Z\n"
                + "SELECT 2;\n"
                + "# Time: 2018-12-17T15:19:00Z\n"
                + "SELECT 3;\n";
        SlowLogFramer framer = framer(log);
        framer.readPreamble();
        long lines = framer.call();

        List<RawRecordBlock> result = drain();
        assertEquals(3, result.size());
        assertEquals(List.of("# Time: 2018-12-17T15:18:58.744913Z",
                "# Query_time: 0.1  Lock_time: 0.0  Rows_sent: 0  Rows_examined: 0", "SELECT 1;"),
                result.get(0).getLines());
        assertEquals(List.of("# Time: 2018-12-17T15:19:00Z", "SELECT 3;"), result.get(2).getLines());
        assertEquals(10, lines);
        assertEquals(10, framer.getLinesRead());
    }

    @Test
    public void testLogWithoutPreamble() throws Exception {
        SlowLogFramer framer = framer("# Time: 2018-12-17T15:18:58Z\nSELECT 1;\n");
        ServerInfo info = framer.readPreamble();
        assertEquals(ServerInfo.UNPARSABLE, info.getBinary());

        framer.call();
        List<RawRecordBlock> result = drain();
        assertEquals(1, result.size());
        assertEquals(List.of("# Time: 2018-12-17T15:18:58Z", "SELECT 1;"), result.get(0).getLines());
    }

    @Test
    public void testMultiLineStatementFolds() throws Exception {
        String log = PREAMBLE
                + "# Time: 2018-12-17T15:18:58Z\n"
                + "SET timestamp=1545059938;\n"
                + "SELECT *\n"
                + "  FROM users\n"
                + "  WHERE id = 1;\n"
                + "# Time: 2018-12-17T15:18:59Z\n"
                + "SELECT 2;\n";
        SlowLogFramer framer = framer(log);
        framer.call();

        List<RawRecordBlock> result = drain();
        assertEquals(2, result.size());
        assertEquals(List.of("# Time: 2018-12-17T15:18:58Z", "SET timestamp=1545059938;",
                "SELECT *   FROM users   WHERE id = 1;"), result.get(0).getLines());
    }

    @Test
    public void testAnnotationAfterUnterminatedStatementIsNotFolded() throws Exception {
        String log = "# Time: 2018-12-17T15:18:58Z\n"
                + "SELECT 1\n"
                + "# Query_time: 0.1  Lock_time: 0.0  Rows_sent: 0  Rows_examined: 0\n";
        SlowLogFramer framer = framer(log);
        framer.call();

        RawRecordBlock block = drain().get(0);
        assertEquals(3, block.size());
        assertEquals("SELECT 1", block.getLines().get(1));
    }

    @Test
    public void testDuplicateHeadersAndBlankLinesSkipped() throws Exception {
        String log = PREAMBLE
                + "# Time: 2018-12-17T15:18:58Z\n"
                + "SELECT 1;\n"
                + "\n"
                + "/usr/sbin/mysqld, Version: 5.7.24-log (MySQL Community Server (GPL)). started with:\n"
                + "Tcp port: 3306  Unix socket: /var/run/mysqld/mysqld.sock\n"
                + "Time                 Id Command    Argument\n"
                + "# Time: 2018-12-17T15:18:59Z\n"
                + "SELECT 2;\n";
        SlowLogFramer framer = framer(log);
        framer.call();

        List<RawRecordBlock> result = drain();
        assertEquals(2, result.size());
        assertEquals(List.of("# Time: 2018-12-17T15:18:58Z", "SELECT 1;"), result.get(0).getLines());
    }

    @Test
    public void testIsDuplicateHeader() {
        assertTrue(SlowLogFramer.isDuplicateHeader("mysqld, Version: 5.7.24-log (x). started with:"));
        assertTrue(SlowLogFramer.isDuplicateHeader("/usr/sbin/mysqld, Version: 5.7.24-log (x). started with:"));
        assertTrue(SlowLogFramer.isDuplicateHeader("Tcp port: 3306  Unix socket: /tmp/mysql.sock"));
        assertTrue(SlowLogFramer.isDuplicateHeader("Time                 Id Command    Argument"));
        assertFalse(SlowLogFramer.isDuplicateHeader("SELECT 1;"));
        assertFalse(SlowLogFramer.isDuplicateHeader("# Time: 2018-12-17T15:18:58Z"));
    }

    @Test
    public void testOverflowLinesDropped() throws Exception {
        StringBuilder log = new StringBuilder("# Time: 2018-12-17T15:18:58Z\n");
        for (int i = 0; i < 5; i++) {
            log.append("# Extra_").append(i).append(": 1\n");
        }
        SlowLogFramer framer = new SlowLogFramer(new BufferedReader(new StringReader(log.toString())), blocks, 3);
        framer.call();

        RawRecordBlock block = drain().get(0);
        assertEquals(3, block.size());
        assertEquals("# Extra_1: 1", block.lastLine());
    }

    @Test
    public void testFinalBlockFlushedAtEndOfStream() throws Exception {
        SlowLogFramer framer = framer("# Time: 2018-12-17T15:18:58Z\nSELECT 1;");
        framer.call();
        assertEquals(1, drain().size());
    }

    @Test
    public void testLineCountMatchesNewlineCount() throws Exception {
        String log = PREAMBLE + "# Time: 2018-12-17T15:18:58Z\nselect 1;";
        SlowLogFramer framer = framer(log);
        long lines = framer.call();

        assertEquals(log.chars().filter(c -> c == '\n').count(), lines);
        assertEquals(4, lines);
        assertEquals(List.of("# Time: 2018-12-17T15:18:58Z", "select 1;"), drain().get(0).getLines());
    }

    @Test
    public void testLoneCarriageReturnKeptInStatement() throws Exception {
        String log = PREAMBLE + "# Time: 2018-12-17T15:18:58Z\nselect 'a\rb';\n";
        SlowLogFramer framer = framer(log);
        long lines = framer.call();

        assertEquals(5, lines);
        assertEquals(List.of("# Time: 2018-12-17T15:18:58Z", "select 'a\rb';"), drain().get(0).getLines());
    }

    @Test
    public void testCrlfLineEndings() throws Exception {
        String log = PREAMBLE.replace("\n", "\r\n") + "# Time: 2018-12-17T15:18:58Z\r\nSELECT 1;\r\n";
        SlowLogFramer framer = framer(log);
        framer.readPreamble();
        long lines = framer.call();

        assertEquals(5, lines);
        assertEquals(List.of("# Time: 2018-12-17T15:18:58Z", "SELECT 1;"), drain().get(0).getLines());
    }

    @Test
    public void testMalformedListenerLine() {
        String identity = "/usr/sbin/mysqld, Version: 5.7.24-log (MySQL Community Server (GPL)). started with:";
        for (String listeners : new String[] { null, "Tcp port", "Tcp port: x  Unix socket: /tmp/mysql.sock",
                "Tcp port: 3306" }) {
            ServerInfo info = SlowLogFramer.parseServerInfo(identity, listeners);
            assertEquals(ServerInfo.UNPARSABLE, info.getBinary());
            assertEquals(ServerInfo.UNPARSABLE, info.getVersion());
            assertEquals(ServerInfo.UNPARSABLE, info.getUnixSocket());
            assertEquals(0, info.getTcpPort());
        }
    }
}
