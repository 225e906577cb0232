package com.querydigest.log.parser.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

public class ServerInfoTest {

    @Test
    public void testObserveIsOrderIndependent() {
        Instant t1 = Instant.parse("2018-12-17T15:00:00Z");
        Instant t2 = Instant.parse("2018-12-17T15:00:10Z");
        Instant t3 = Instant.parse("2018-12-17T15:01:00Z");

        ServerInfo info = new ServerInfo();
        info.observe(t2);
        info.observe(t3);
        info.observe(null);
        info.observe(t1);

        assertEquals(t1, info.getStart());
        assertEquals(t3, info.getEnd());
        assertEquals(Duration.ofSeconds(60), info.getCaptureSpan());
        assertEquals(60.0, info.getCaptureSpanSeconds());
    }

    @Test
    public void testQps() {
        ServerInfo info = new ServerInfo();
        assertEquals(0.0, info.getQps());

        info.observe(Instant.parse("2018-12-17T15:00:00Z"));
        info.observe(Instant.parse("2018-12-17T15:00:04Z"));
        for (int i = 0; i < 10; i++) {
            info.incrementQueryCount();
        }
        assertEquals(2.5, info.getQps());
    }

    @Test
    public void testCopy() {
        ServerInfo info = new ServerInfo("/usr/sbin/mysqld", "5.7.24", "5.7.24-log", "MySQL", 3306, "/tmp/s");
        info.addBytes(100);
        info.incrementQueryCount();
        info.observe(Instant.parse("2018-12-17T15:00:00Z"));

        ServerInfo copy = info.copy();
        assertEquals(info, copy);
        copy.addBytes(1);
        assertNotEquals(info, copy);
        assertEquals(100, info.getCumBytes());
    }
}
