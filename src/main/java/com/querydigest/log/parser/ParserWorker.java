package com.querydigest.log.parser;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.parser.model.QueryEvent;
import com.querydigest.log.parser.model.RawRecordBlock;

/**
 * Takes record blocks off the block queue, parses them and puts the resulting events on the event
 * queue until it sees {@link RawRecordBlock#END_OF_STREAM}. Workers share nothing but the queues.
 */
class ParserWorker implements Callable<WorkerStats> {

    private static final Logger logger = LoggerFactory.getLogger(ParserWorker.class);

    private final BlockingQueue<RawRecordBlock> blocks;
    private final BlockingQueue<QueryEvent> events;
    private final SlowLogRecordParser parser;

    ParserWorker(BlockingQueue<RawRecordBlock> blocks, BlockingQueue<QueryEvent> events,
            SlowLogRecordParser parser) {
        this.blocks = blocks;
        this.events = events;
        this.parser = parser;
    }

    @Override
    public WorkerStats call() throws InterruptedException {
        long localEvents = 0;
        long localDropped = 0;

        while (true) {
            RawRecordBlock block = blocks.take();
            if (block == RawRecordBlock.END_OF_STREAM) {
                break;
            }

            Optional<QueryEvent> event = parser.parse(block);
            if (event.isPresent()) {
                events.put(event.get());
                localEvents++;
            } else {
                // Records without a statement are expected (e.g. administrator commands)
                localDropped++;
            }
        }

        logger.debug("worker {} exiting: {} events, {} records without statement",
                Thread.currentThread().getName(), localEvents, localDropped);
        return new WorkerStats(localEvents, localDropped);
    }
}
