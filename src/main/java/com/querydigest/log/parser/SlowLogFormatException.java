package com.querydigest.log.parser;

import java.io.IOException;

/**
 * The input does not look like a slow query log at all (no record boundary was found).
 */
public class SlowLogFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public SlowLogFormatException(String message) {
        super(message);
    }
}
