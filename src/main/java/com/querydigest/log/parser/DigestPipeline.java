package com.querydigest.log.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.config.DigestConfig;
import com.querydigest.log.parser.accumulator.QueryStatsAggregator;
import com.querydigest.log.parser.accumulator.SnapshotListener;
import com.querydigest.log.parser.cache.SnapshotCache;
import com.querydigest.log.parser.model.QueryEvent;
import com.querydigest.log.parser.model.RawRecordBlock;
import com.querydigest.log.parser.model.ServerInfo;
import com.querydigest.log.parser.model.Snapshot;

/**
 * Wires one framer, N parser workers and one aggregator together through two bounded queues.
 * <pre>
 * reader -> framer -> [blocks] -> workers -> [events] -> aggregator -> snapshots
 * </pre>
 * The framer closes the block queue with one end marker per worker; the last worker to exit
 * closes the event queue. Full queues block their producer, nothing is dropped.
 */
public class DigestPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DigestPipeline.class);

    private final DigestConfig config;

    public DigestPipeline(DigestConfig config) {
        this.config = config;
    }

    /**
     * Ingests the whole stream and returns the final snapshot, which has also been passed to the
     * listener (and written to the cache, when one is given).
     *
     * @param cache         null to disable caching
     * @param expectedLines line count of the input if known, for progress logging; 0 otherwise
     * @throws ExecutionException wrapping the first fatal failure of any stage
     */
    public Snapshot run(BufferedReader reader, SnapshotListener listener, SnapshotCache cache, long expectedLines)
            throws IOException, InterruptedException, ExecutionException {
        int numWorkers = Math.max(1, config.getWorkers());
        BlockingQueue<RawRecordBlock> blocks = new ArrayBlockingQueue<>(config.getQueueCapacity());
        BlockingQueue<QueryEvent> events = new ArrayBlockingQueue<>(config.getQueueCapacity());

        SlowLogFramer framer = new SlowLogFramer(reader, blocks);
        framer.setProgress(config.isProgress(), expectedLines);
        ServerInfo server = framer.readPreamble();
        logger.info("server: {}", server);

        QueryStatsAggregator aggregator = new QueryStatsAggregator(events, server, framer::getLinesRead,
                config.getRefreshMillis(), listener, cache);
        SlowLogRecordParser parser = new SlowLogRecordParser();

        ExecutorService executor = Executors.newFixedThreadPool(numWorkers + 2);
        CompletionService<Object> completionService = new ExecutorCompletionService<>(executor);

        try {
            Future<Object> aggregatorFuture = completionService.submit(aggregator::call);

            AtomicInteger runningWorkers = new AtomicInteger(numWorkers);
            for (int i = 0; i < numWorkers; i++) {
                ParserWorker worker = new ParserWorker(blocks, events, parser);
                completionService.submit(() -> {
                    WorkerStats stats = worker.call();
                    if (runningWorkers.decrementAndGet() == 0) {
                        events.put(QueryEvent.END_OF_STREAM);
                    }
                    return stats;
                });
            }

            completionService.submit(() -> {
                Long lines = framer.call();
                for (int i = 0; i < numWorkers; i++) {
                    blocks.put(RawRecordBlock.END_OF_STREAM);
                }
                return lines;
            });

            long totalEvents = 0;
            long totalDropped = 0;
            while (true) {
                Future<Object> done = completionService.take();
                Object result = done.get();
                if (done == aggregatorFuture) {
                    logger.debug("pipeline done: {} events, {} records without statement", totalEvents,
                            totalDropped);
                    return (Snapshot) result;
                }
                if (result instanceof WorkerStats) {
                    WorkerStats stats = (WorkerStats) result;
                    totalEvents += stats.events;
                    totalDropped += stats.dropped;
                } else if (result instanceof Long) {
                    logger.info("read {} lines", result);
                }
            }
        } catch (ExecutionException | InterruptedException e) {
            executor.shutdownNow();
            throw e;
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
    }
}
