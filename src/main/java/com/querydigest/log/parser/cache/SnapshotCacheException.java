package com.querydigest.log.parser.cache;

import java.io.IOException;

/**
 * The final snapshot could not be written to the cache file.
 */
public class SnapshotCacheException extends IOException {

    private static final long serialVersionUID = 1L;

    public SnapshotCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
