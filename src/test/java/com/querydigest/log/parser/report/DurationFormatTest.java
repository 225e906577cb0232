package com.querydigest.log.parser.report;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class DurationFormatTest {

    @Test
    public void testFormat() {
        assertEquals("0µs", DurationFormat.format(0));
        assertEquals("250µs", DurationFormat.format(0.000250));
        assertEquals("12.500ms", DurationFormat.format(0.0125));
        assertEquals("3.200s", DurationFormat.format(3.2));
        assertEquals("2m5.000s", DurationFormat.format(125));
        assertEquals("1h1m1.500s", DurationFormat.format(3661.5));
        assertEquals("-3.200s", DurationFormat.format(-3.2));
    }
}
