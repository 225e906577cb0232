package com.querydigest.log.parser.input;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream over a growing log file, in the manner of {@code tail -F}: reads block until more bytes are
 * appended, and the file is re-opened from its start when it is truncated or replaced (log rotation).
 * It only reaches end of stream after {@link #close()}.
 */
public class FollowingInputStream extends InputStream {

    private static final Logger logger = LoggerFactory.getLogger(FollowingInputStream.class);

    private final Path path;
    private final long pollIntervalMs;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private FileChannel channel;
    private Object fileKey;
    private long position;

    public FollowingInputStream(Path path, long pollIntervalMs) {
        this.path = path;
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n == -1 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        while (!closed.get()) {
            if (channel == null && !open()) {
                pause();
                continue;
            }

            int n = channel.read(ByteBuffer.wrap(b, off, len), position);
            if (n > 0) {
                position += n;
                return n;
            }

            if (rotated()) {
                logger.info("log rotation detected on {}, re-opening from start", path);
                closeChannel();
                continue;
            }
            pause();
        }
        return -1;
    }

    private boolean open() throws IOException {
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            logger.debug("waiting for {} to appear", path);
            return false;
        }
        fileKey = currentFileKey();
        position = 0;
        logger.debug("following {}", path);
        return true;
    }

    /**
     * True when the file at {@link #path} is shorter than what was read, or is another file.
     */
    private boolean rotated() throws IOException {
        try {
            if (Files.size(path) < position) {
                return true;
            }
            Object key = currentFileKey();
            return fileKey != null && key != null && !fileKey.equals(key);
        } catch (NoSuchFileException e) {
            // Moved away, its replacement has not been created yet
            return false;
        }
    }

    private Object currentFileKey() throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class).fileKey();
    }

    private void pause() throws InterruptedIOException {
        try {
            Thread.sleep(pollIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while following " + path);
        }
    }

    private void closeChannel() throws IOException {
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            closeChannel();
        }
    }
}
