package com.querydigest.log.parser.accumulator;

import com.querydigest.log.parser.model.Snapshot;

/**
 * Receives periodic and final snapshots from the aggregator, on the aggregator thread.
 */
@FunctionalInterface
public interface SnapshotListener {

    void onSnapshot(Snapshot snapshot);
}
