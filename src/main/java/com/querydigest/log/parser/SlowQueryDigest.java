package com.querydigest.log.parser;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.config.DigestConfig;
import com.querydigest.log.parser.accumulator.SnapshotListener;
import com.querydigest.log.parser.accumulator.SortKey;
import com.querydigest.log.parser.cache.SnapshotCache;
import com.querydigest.log.parser.input.FollowingInputStream;
import com.querydigest.log.parser.model.Snapshot;
import com.querydigest.log.parser.report.ReportFormat;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Digest of a MySQL/MariaDB slow query log: groups statements by fingerprint and reports the heaviest ones.
 */
@Command(name = "slow-query-digest", mixinStandardHelpOptions = true, version = "1.0",
        description = "Summarize a MySQL/MariaDB slow query log by normalized query fingerprint")
public class SlowQueryDigest implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(SlowQueryDigest.class);

    private static final String STDIN = "-";

    @Parameters(index = "0", arity = "0..1", description = "Slow query log file, '-' or nothing for stdin")
    private String fileName;

    @Option(names = { "--top" }, description = "Number of queries to display (default: 20)")
    private Integer top;

    @Option(names = { "--sort" }, description = "Sort key: time, count, bytes, lock, sent, examined, affected")
    private String sort;

    @Option(names = { "--reverse" }, description = "Sort ascending instead of descending")
    private boolean reverse = false;

    @Option(names = { "--output" }, description = "Report output: terminal, json, greppable, null")
    private String output;

    @Option(names = { "--list-outputs" }, description = "List the report outputs and exit")
    private boolean listOutputs = false;

    @Option(names = { "--nocache" }, description = "Do not read or write the result cache")
    private boolean noCache = false;

    @Option(names = { "--follow" }, description = "Follow the file as it grows, surviving rotation")
    private boolean follow = false;

    @Option(names = { "--refresh" }, description = "Emit a partial report every MS milliseconds (0 disables)",
            paramLabel = "MS")
    private Long refreshMillis;

    @Option(names = { "--workers" }, description = "Number of parser threads (default: cpu count)")
    private Integer workers;

    @Option(names = { "--config" }, description = "Properties configuration file")
    private String configFile;

    @Option(names = { "--progress" }, description = "Log ingestion progress")
    private boolean progress = false;

    @Option(names = { "--debug" }, description = "Enable debug logging")
    private boolean debug = false;

    @Option(names = { "--quiet" }, description = "Only log errors")
    private boolean quiet = false;

    private final DigestConfig config = new DigestConfig();

    private PrintStream out = System.out;

    @Override
    public Integer call() {
        if (listOutputs) {
            for (ReportFormat format : ReportFormat.values()) {
                out.println(format.displayName());
            }
            return 0;
        }
        configureLogging();
        loadConfiguration();
        applyOverrides();

        try {
            ReportFormat format = ReportFormat.parse(config.getOutput());
            run(format);
            return 0;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("digest failed: {}", cause.getMessage(), cause);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("digest interrupted");
            return 1;
        } catch (IOException | RuntimeException e) {
            logger.error("digest failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void run(ReportFormat format) throws IOException, InterruptedException, ExecutionException {
        boolean fromStdin = fileName == null || STDIN.equals(fileName);
        boolean staticFile = !fromStdin && !config.isFollow();

        SnapshotCache cache = null;
        long expectedLines = 0;
        if (staticFile) {
            Path path = Paths.get(fileName);
            if (!Files.isRegularFile(path)) {
                throw new IOException("no such file: " + fileName);
            }
            if (config.isCacheEnabled()) {
                cache = new SnapshotCache(path);
                Optional<Snapshot> cached = cache.read();
                if (cached.isPresent()) {
                    logger.info("using cached results from {}", cache.getCacheFile());
                    render(format, cached.get());
                    return;
                }
            }
            expectedLines = LineCounter.count(path);
            logger.info("file has {} lines", expectedLines);
        }

        SnapshotListener listener = snapshot -> render(format, snapshot);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(openInput(fromStdin), StandardCharsets.UTF_8))) {
            new DigestPipeline(config).run(reader, listener, cache, expectedLines);
        }
    }

    private InputStream openInput(boolean fromStdin) throws IOException {
        if (fromStdin) {
            return System.in;
        }
        if (config.isFollow()) {
            return new FollowingInputStream(Paths.get(fileName), config.getFollowPollMillis());
        }
        return new FileInputStream(fileName);
    }

    private void render(ReportFormat format, Snapshot snapshot) {
        Snapshot view = snapshot.sorted(config.getSortKey(), config.isReverse()).top(config.getTop());
        format.render(view, out);
    }

    private void configureLogging() {
        Level level = debug ? Level.DEBUG : quiet ? Level.ERROR : null;
        if (level == null) {
            return;
        }
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
        }
    }

    private void loadConfiguration() {
        if (configFile != null) {
            try (InputStream in = new FileInputStream(configFile)) {
                Properties props = new Properties();
                props.load(in);
                config.loadFromProperties(props);
                logger.info("Loaded configuration from: {}", configFile);
            } catch (IOException e) {
                logger.warn("Could not load config file: {}. Using defaults.", configFile);
            }
        }
    }

    private void applyOverrides() {
        if (top != null) {
            config.setTop(top);
        }
        if (sort != null) {
            config.setSortKey(SortKey.parse(sort));
        }
        if (reverse) {
            config.setReverse(true);
        }
        if (output != null) {
            config.setOutput(output);
        }
        if (noCache) {
            config.setCacheEnabled(false);
        }
        if (follow) {
            config.setFollow(true);
        }
        if (refreshMillis != null) {
            config.setRefreshMillis(refreshMillis);
        }
        if (workers != null) {
            config.setWorkers(workers);
        }
        if (progress) {
            config.setProgress(true);
        }
    }

    DigestConfig getConfig() {
        return config;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SlowQueryDigest()).execute(args);
        System.exit(exitCode);
    }
}
