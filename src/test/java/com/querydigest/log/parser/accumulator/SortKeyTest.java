package com.querydigest.log.parser.accumulator;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class SortKeyTest {

    @Test
    public void testParse() {
        assertEquals(SortKey.TIME, SortKey.parse("time"));
        assertEquals(SortKey.COUNT, SortKey.parse("Count"));
        assertEquals(SortKey.BYTES, SortKey.parse("bytes"));
        assertEquals(SortKey.LOCK, SortKey.parse("lock"));
        assertEquals(SortKey.SENT, SortKey.parse("sent"));
        assertEquals(SortKey.EXAMINED, SortKey.parse("examined"));
        assertEquals(SortKey.AFFECTED, SortKey.parse(" affected "));
    }

    @Test
    public void testAliases() {
        assertEquals(SortKey.LOCK, SortKey.parse("locktime"));
        assertEquals(SortKey.SENT, SortKey.parse("rowssent"));
        assertEquals(SortKey.EXAMINED, SortKey.parse("rowsexamined"));
        assertEquals(SortKey.AFFECTED, SortKey.parse("rowsaffected"));
    }

    @Test
    public void testUnknownFallsBackToTime() {
        assertEquals(SortKey.TIME, SortKey.parse("nonsense"));
        assertEquals(SortKey.TIME, SortKey.parse(null));
    }
}
