package io.autotrade.infrastructure.metrics;

import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.market.Market;

/**
 * Ingestion metrics interface for monitoring.
 *
 * Implementations can publish to Prometheus or anything else; the core only
 * talks to this interface.
 */
public interface IngestionMetrics {

    String INSERTED = "inserted";
    String UNCHANGED = "unchanged";
    String CONFLICT = "conflict";
    String INVALID = "invalid";

    /**
     * Record the outcome of one bar ingestion.
     *
     * @param key     Partition written to
     * @param outcome One of INSERTED, UNCHANGED, CONFLICT, INVALID
     */
    void recordBar(PartitionKey key, String outcome);

    /**
     * Record an accepted (or rejected) tick.
     */
    void recordTick(Market market, boolean accepted);

    /**
     * Record a tick that arrived after its bucket was finalized.
     *
     * @param action "dropped" or "rejected"
     */
    void recordLateTick(Market market, String action);

    /**
     * Record a transient storage failure surfaced to a caller.
     */
    void recordStorageFailure(String operation);

    /**
     * Record ticks removed by the retention job.
     */
    void recordTicksPurged(Market market, int count);

    /**
     * Current number of events waiting in the ingestion queue.
     */
    void recordQueueDepth(int depth);

    IngestionMetrics NOOP = new IngestionMetrics() {
        @Override public void recordBar(PartitionKey key, String outcome) {}
        @Override public void recordTick(Market market, boolean accepted) {}
        @Override public void recordLateTick(Market market, String action) {}
        @Override public void recordStorageFailure(String operation) {}
        @Override public void recordTicksPurged(Market market, int count) {}
        @Override public void recordQueueDepth(int depth) {}
    };
}
