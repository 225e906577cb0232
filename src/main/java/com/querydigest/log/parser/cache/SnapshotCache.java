package com.querydigest.log.parser.cache;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.querydigest.log.parser.model.Snapshot;

/**
 * Sidecar cache of the final snapshot of a log file, stored next to it as {@code <file>.cache}.
 * A cache is only used when it is at least as recent as the log file.
 */
public class SnapshotCache {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotCache.class);

    static final String SUFFIX = ".cache";

    private final Path source;
    private final Path cacheFile;

    public SnapshotCache(Path source) {
        this.source = source;
        this.cacheFile = cachePathFor(source);
    }

    public static Path cachePathFor(Path source) {
        return source.resolveSibling(source.getFileName().toString() + SUFFIX);
    }

    /**
     * Writes every entry of the snapshot; callers trim for display afterwards.
     *
     * @throws SnapshotCacheException on any I/O failure
     */
    public void write(Snapshot snapshot) throws SnapshotCacheException {
        logger.info("caching results in {}", cacheFile);
        try (BufferedWriter writer = Files.newBufferedWriter(cacheFile, StandardCharsets.UTF_8)) {
            SnapshotJson.mapper().writerWithDefaultPrettyPrinter().writeValue(writer, SnapshotJson.toJson(snapshot));
        } catch (IOException e) {
            throw new SnapshotCacheException("unable to write to cache file " + cacheFile, e);
        }
    }

    /**
     * @return the cached snapshot, or empty when there is no usable cache (missing, stale or unreadable)
     */
    public Optional<Snapshot> read() {
        FileTime sourceTime;
        FileTime cacheTime;
        try {
            sourceTime = Files.getLastModifiedTime(source);
        } catch (IOException e) {
            logger.error("unable to get file information for {}: {}", source, e.getMessage());
            return Optional.empty();
        }
        try {
            cacheTime = Files.getLastModifiedTime(cacheFile);
        } catch (NoSuchFileException e) {
            logger.info("cache file {} not found", cacheFile);
            return Optional.empty();
        } catch (IOException e) {
            logger.error("unable to get file information for {}: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }

        if (isStale(sourceTime, cacheTime)) {
            logger.info("skipping stale cache {}", cacheFile);
            return Optional.empty();
        }

        try (InputStream in = Files.newInputStream(cacheFile)) {
            JsonNode root = SnapshotJson.mapper().readTree(in);
            if (root == null || root.isMissingNode()) {
                logger.error("cache file {} is empty", cacheFile);
                return Optional.empty();
            }
            return Optional.of(SnapshotJson.fromJson(root));
        } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
            logger.error("unable to read cache {}: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
    }

    static boolean isStale(FileTime sourceTime, FileTime cacheTime) {
        return sourceTime.compareTo(cacheTime) > 0;
    }

    public Path getCacheFile() {
        return cacheFile;
    }
}
