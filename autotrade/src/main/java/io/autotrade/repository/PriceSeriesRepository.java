package io.autotrade.repository;

import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage contract for partitioned bar tables and per-market tick tables.
 *
 * Implementations translate storage failures into
 * {@link io.autotrade.domain.common.StorageUnavailableException} and never retry.
 */
public interface PriceSeriesRepository {

    /**
     * Create the bar partition if it does not exist yet.
     */
    void ensurePartition(PartitionKey key);

    /**
     * Create the tick table of a market if it does not exist yet.
     */
    void ensureTickPartition(Market market);

    /**
     * Bar partitions currently present in storage.
     */
    Set<PartitionKey> discoverPartitions();

    /**
     * Markets that currently have a tick table.
     */
    Set<Market> discoverTickMarkets();

    /**
     * Insert the bar unless its key is taken. Atomic per bar.
     *
     * @return empty if inserted, otherwise the bar already stored under the key
     */
    Optional<OhlcvBar> insertIfAbsent(OhlcvBar bar);

    /**
     * One page of bars with {@code from <= periodStart <= to} and
     * {@code periodStart > afterExclusive} (when given), ascending.
     */
    List<OhlcvBar> findRange(PartitionKey key, Instant from, Instant to, Instant afterExclusive, int limit);

    /**
     * Latest bar with {@code periodStart <= at}.
     */
    Optional<OhlcvBar> findLatestAtOrBefore(PartitionKey key, Instant at);

    void appendTick(PriceTick tick);

    /**
     * Ticks with {@code from <= timestamp < to}, in timestamp then arrival order.
     */
    List<PriceTick> findTicks(Market market, Instant from, Instant to);

    /**
     * Delete ticks strictly older than the cutoff.
     *
     * @return number of deleted ticks
     */
    int deleteTicksOlderThan(Market market, Instant cutoff);
}
