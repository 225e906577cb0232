package com.querydigest.log.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.parser.model.RawRecordBlock;
import com.querydigest.log.parser.model.ServerInfo;

/**
 * Splits a slow query log into record blocks, one per query occurrence, and pushes them to the
 * block queue. Field semantics are left to {@link SlowLogRecordParser}.
 *
 * The preamble written by the server when it opens the log is read separately by
 * {@link #readPreamble()} before framing starts, e.g.
 * <pre>
 * /usr/sbin/mysqld, Version: 5.7.24-log (MySQL Community Server (GPL)). started with:
 * Tcp port: 3306  Unix socket: /var/run/mysqld/mysqld.sock
 * Time                 Id Command    Argument
 * </pre>
 */
public class SlowLogFramer implements Callable<Long> {

    private static final Logger logger = LoggerFactory.getLogger(SlowLogFramer.class);

    static final String BOUNDARY = "# Time";

    private static final Pattern VERSION_PATTERN = Pattern.compile(
        "^([^,]+),\\s+Version:\\s+([0-9.]+)([a-z0-9-]+)\\s+\\((.*)\\)\\. started");

    private final BufferedReader reader;
    private final BlockingQueue<RawRecordBlock> blocks;
    private final int blockCapacity;
    private final AtomicLong linesRead = new AtomicLong();
    private final char[] buffer = new char[8192];
    private int bufferPos = 0;
    private int bufferLen = 0;

    private long expectedLines = 0;
    private boolean progress = false;
    private String pendingBoundary = null;
    private boolean preambleRead = false;

    public SlowLogFramer(BufferedReader reader, BlockingQueue<RawRecordBlock> blocks) {
        this(reader, blocks, RawRecordBlock.DEFAULT_CAPACITY);
    }

    public SlowLogFramer(BufferedReader reader, BlockingQueue<RawRecordBlock> blocks, int blockCapacity) {
        this.reader = reader;
        this.blocks = blocks;
        this.blockCapacity = blockCapacity;
    }

    /**
     * Enables progress logging every 10% of {@code expectedLines}.
     */
    public void setProgress(boolean progress, long expectedLines) {
        this.progress = progress;
        this.expectedLines = expectedLines;
    }

    /**
     * Reads the identity, listener and column header lines. A preamble that does not match the
     * expected grammar yields {@link ServerInfo#unparsable()}; framing can still go on.
     */
    public ServerInfo readPreamble() throws IOException {
        preambleRead = true;
        String[] preamble = new String[3];
        for (int i = 0; i < preamble.length; i++) {
            String line = readLine();
            if (line == null) {
                break;
            }
            if (line.startsWith(BOUNDARY)) {
                // No (or a truncated) preamble; keep the boundary for framing
                pendingBoundary = line;
                break;
            }
            preamble[i] = line;
        }
        return parseServerInfo(preamble[0], preamble[1]);
    }

    static ServerInfo parseServerInfo(String version, String listeners) {
        if (version == null) {
            logger.warn("unable to parse server information; beginning of log might be missing");
            return ServerInfo.unparsable();
        }
        Matcher m = VERSION_PATTERN.matcher(version);
        if (!m.find()) {
            logger.warn("unable to parse server information; beginning of log might be missing");
            return ServerInfo.unparsable();
        }
        if (listeners == null) {
            logger.warn("missing listener line in log preamble");
            return ServerInfo.unparsable();
        }
        String[] words = listeners.split(" ");
        String[] parts = listeners.split(":");
        if (words.length < 3 || parts.length < 3) {
            logger.warn("unable to parse listener line: {}", listeners);
            return ServerInfo.unparsable();
        }
        int tcpPort;
        try {
            tcpPort = Integer.parseInt(words[2]);
        } catch (NumberFormatException e) {
            logger.warn("unable to parse TCP port from listener line: {}", listeners);
            return ServerInfo.unparsable();
        }
        return new ServerInfo(m.group(1), m.group(2), m.group(2) + m.group(3), m.group(4), tcpPort,
                parts[2].stripLeading());
    }

    /**
     * Frames the rest of the stream. Returns the number of newline-terminated lines read, preamble
     * included.
     *
     * @throws SlowLogFormatException if no record boundary exists before the end of the stream
     */
    @Override
    public Long call() throws IOException, InterruptedException {
        if (!preambleRead) {
            readPreamble();
        }

        String line = pendingBoundary;
        while (line == null || !line.startsWith(BOUNDARY)) {
            line = readLine();
            if (line == null) {
                throw new SlowLogFormatException("unable to find initial '" + BOUNDARY + "' entry");
            }
        }

        RawRecordBlock current = newBlock(line);
        boolean foldNext = false;
        int blocksSent = 0;

        while ((line = readLine()) != null) {
            if (line.startsWith(BOUNDARY)) {
                blocks.put(current);
                blocksSent++;
                current = newBlock(line);
                foldNext = false;
                continue;
            }

            if (line.isBlank() || isDuplicateHeader(line)) {
                continue;
            }

            boolean annotation = line.startsWith("#");
            if (foldNext && !annotation) {
                current.foldIntoLast(line);
            } else if (!current.add(line)) {
                logger.warn("request to add line {} exceeds record capacity of {} (record at line {}): {}",
                        linesRead.get(), blockCapacity, current.getPosition(),
                        line.substring(0, Math.min(200, line.length())));
                continue;
            }

            String last = current.lastLine();
            foldNext = !last.startsWith("#") && !last.stripTrailing().endsWith(";");
            if (foldNext && logger.isTraceEnabled()) {
                logger.trace("line {} will fold", linesRead.get() + 1);
            }
        }

        blocks.put(current);
        blocksSent++;
        logger.debug("framer done: {} lines, {} records", linesRead.get(), blocksSent);
        return linesRead.get();
    }

    private RawRecordBlock newBlock(String boundary) {
        RawRecordBlock block = new RawRecordBlock(linesRead.get(), blockCapacity);
        block.add(boundary);
        return block;
    }

    /**
     * Headers the server writes again when it reopens the log (e.g. after FLUSH LOGS).
     */
    static boolean isDuplicateHeader(String line) {
        int space = line.indexOf(' ');
        String firstWord = space < 0 ? line : line.substring(0, space);
        return firstWord.equals("mysqld,")
                || firstWord.endsWith("/mysqld,")
                || firstWord.equals("Tcp")
                || firstWord.equals("Time");
    }

    /**
     * Next line split on '\n' only, with one trailing '\r' dropped. Only newline-terminated lines
     * are counted; an unterminated last line is returned but not counted.
     */
    private String readLine() throws IOException {
        StringBuilder line = null;
        while (true) {
            if (bufferPos >= bufferLen) {
                bufferLen = reader.read(buffer, 0, buffer.length);
                bufferPos = 0;
                if (bufferLen < 0) {
                    bufferLen = 0;
                    return line == null ? null : dropCarriageReturn(line);
                }
            }
            int start = bufferPos;
            while (bufferPos < bufferLen && buffer[bufferPos] != '\n') {
                bufferPos++;
            }
            if (line == null) {
                line = new StringBuilder(bufferPos - start + 16);
            }
            line.append(buffer, start, bufferPos - start);
            if (bufferPos < bufferLen) {
                bufferPos++;
                countLine();
                return dropCarriageReturn(line);
            }
        }
    }

    private static String dropCarriageReturn(StringBuilder line) {
        int len = line.length();
        if (len > 0 && line.charAt(len - 1) == '\r') {
            line.setLength(len - 1);
        }
        return line.toString();
    }

    private void countLine() {
        long n = linesRead.incrementAndGet();
        if (progress && expectedLines > 0 && n % Math.max(1, expectedLines / 10) == 0) {
            logger.info("progress: {} / {} lines ({}%)", n, expectedLines, n * 100 / expectedLines);
        }
    }

    /**
     * Lines read so far; safe to call from other threads while framing runs.
     */
    public long getLinesRead() {
        return linesRead.get();
    }
}
