package com.querydigest.log.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Counts newline bytes without decoding the stream.
 */
public final class LineCounter {

    private static final int BUFFER_SIZE = 32 * 1024;

    private LineCounter() {
    }

    public static long count(InputStream in) throws IOException {
        byte[] buf = new byte[BUFFER_SIZE];
        long count = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            for (int i = 0; i < n; i++) {
                if (buf[i] == '\n') {
                    count++;
                }
            }
        }
        return count;
    }

    public static long count(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return count(in);
        }
    }
}
