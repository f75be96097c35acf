package io.autotrade.service.candle;

import io.autotrade.domain.common.ConflictException;
import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.common.StorageUnavailableException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;
import io.autotrade.infrastructure.metrics.IngestionMetrics;
import io.autotrade.repository.PriceSeriesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price Series Store - per-(market, interval) partitioned bar storage plus
 * append-only ticks.
 *
 * Writes to one partition are serialized by a partition lock so that the
 * primary-key conflict rule holds: an identical re-ingestion is a no-op, a
 * differing one raises {@link ConflictException}. Writes to different
 * partitions proceed in parallel, and reads never take a lock.
 */
public final class PriceSeriesStore {
    private static final Logger log = LoggerFactory.getLogger(PriceSeriesStore.class);

    public static final int DEFAULT_PAGE_SIZE = 500;

    private final PriceSeriesRepository repo;
    private final Clock clock;
    private final IngestionMetrics metrics;
    private final int pageSize;
    private final BarValidator validator = new BarValidator();
    private final PartitionLocks locks = new PartitionLocks();

    private final Set<PartitionKey> knownPartitions = ConcurrentHashMap.newKeySet();
    private final Set<Market> knownTickMarkets = ConcurrentHashMap.newKeySet();

    public PriceSeriesStore(PriceSeriesRepository repo, Clock clock, IngestionMetrics metrics, int pageSize) {
        this.repo = repo;
        this.clock = clock;
        this.metrics = metrics;
        this.pageSize = pageSize;
    }

    public PriceSeriesStore(PriceSeriesRepository repo, Clock clock) {
        this(repo, clock, IngestionMetrics.NOOP, DEFAULT_PAGE_SIZE);
    }

    public Clock getClock() {
        return clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // Partitions
    // ═══════════════════════════════════════════════════════════════

    /**
     * Create the partition in storage on first use.
     */
    public void ensurePartition(PartitionKey key) {
        if (knownPartitions.contains(key)) {
            return;
        }
        locks.withLock(key, () -> {
            if (!knownPartitions.contains(key)) {
                repo.ensurePartition(key);
                knownPartitions.add(key);
            }
            return null;
        });
    }

    public void ensureTickPartition(Market market) {
        if (knownTickMarkets.contains(market)) {
            return;
        }
        synchronized (knownTickMarkets) {
            if (!knownTickMarkets.contains(market)) {
                repo.ensureTickPartition(market);
                knownTickMarkets.add(market);
            }
        }
    }

    /**
     * Pick up partitions that already exist in storage.
     *
     * @return markets that own at least one discovered bar or tick partition
     */
    public Set<Market> refreshPartitions() {
        Set<PartitionKey> partitions = repo.discoverPartitions();
        Set<Market> tickMarkets = repo.discoverTickMarkets();
        knownPartitions.addAll(partitions);
        knownTickMarkets.addAll(tickMarkets);

        Set<Market> markets = new HashSet<>(tickMarkets);
        partitions.forEach(p -> markets.add(p.market()));
        log.info("Discovered {} bar partitions and {} tick tables across {} markets",
            partitions.size(), tickMarkets.size(), markets.size());
        return markets;
    }

    public Set<PartitionKey> partitions() {
        return Set.copyOf(knownPartitions);
    }

    public Set<Market> tickMarkets() {
        return Set.copyOf(knownTickMarkets);
    }

    /**
     * Intervals with a partition for the given market, ascending.
     */
    public SortedSet<Integer> availableIntervals(Market market) {
        SortedSet<Integer> minutes = new TreeSet<>();
        for (PartitionKey key : knownPartitions) {
            if (key.market().equals(market)) {
                minutes.add(key.interval().minutes());
            }
        }
        return minutes;
    }

    // ═══════════════════════════════════════════════════════════════
    // Ingestion
    // ═══════════════════════════════════════════════════════════════

    /**
     * Validate and store one bar.
     *
     * @return INSERTED, or UNCHANGED when an identical bar was already stored
     * @throws InvalidBarException         if the bar violates a schema constraint
     * @throws ConflictException           if a different bar is stored under the same key
     * @throws StorageUnavailableException on transient storage failure
     */
    public IngestResult ingestBar(OhlcvBar bar) {
        PartitionKey key = bar.partition();
        try {
            validator.validateBar(bar, clock.instant());
        } catch (InvalidBarException e) {
            metrics.recordBar(key, IngestionMetrics.INVALID);
            throw e;
        }

        try {
            ensurePartition(key);
            IngestResult result = locks.withLock(key, () -> {
                Optional<OhlcvBar> existing = repo.insertIfAbsent(bar);
                if (existing.isEmpty()) {
                    return IngestResult.INSERTED;
                }
                if (existing.get().samePayload(bar)) {
                    return IngestResult.UNCHANGED;
                }
                throw new ConflictException(existing.get(), bar);
            });
            metrics.recordBar(key, result == IngestResult.INSERTED ? IngestionMetrics.INSERTED : IngestionMetrics.UNCHANGED);
            log.debug("Bar {} @ {}: {}", key, bar.periodStart(), result);
            return result;

        } catch (ConflictException e) {
            metrics.recordBar(key, IngestionMetrics.CONFLICT);
            log.warn("Conflict in {}: {}", key, e.getMessage());
            throw e;
        } catch (InvalidBarException e) {
            metrics.recordBar(key, IngestionMetrics.INVALID);
            throw e;
        } catch (StorageUnavailableException e) {
            metrics.recordStorageFailure("ingestBar");
            throw e;
        }
    }

    /**
     * Validate and append one tick. Ticks have no dedup key: duplicates are
     * distinct trades and are all kept.
     */
    public void ingestTick(PriceTick tick) {
        try {
            validator.validateTick(tick, clock.instant());
        } catch (InvalidBarException e) {
            metrics.recordTick(tick.market(), false);
            throw e;
        }

        try {
            ensureTickPartition(tick.market());
            repo.appendTick(tick);
            metrics.recordTick(tick.market(), true);
        } catch (StorageUnavailableException e) {
            metrics.recordStorageFailure("ingestTick");
            throw e;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════

    /**
     * Bars with {@code fromTs <= periodStart <= toTs}, ascending.
     * The returned series is lazy and re-queries on every iteration.
     */
    public BarSeries queryRange(Market market, Interval interval, Instant fromTs, Instant toTs) {
        PartitionKey key = PartitionKey.of(market, interval);
        if (fromTs.isAfter(toTs) || !knownPartitions.contains(key)) {
            return BarSeries.empty();
        }
        return new BarSeries((after, limit) -> {
            try {
                return repo.findRange(key, fromTs, toTs, after, limit);
            } catch (StorageUnavailableException e) {
                metrics.recordStorageFailure("queryRange");
                throw e;
            }
        }, pageSize);
    }

    /**
     * Latest bar whose periodStart is at or before {@code ts}, skipping gaps.
     */
    public Optional<OhlcvBar> latestBefore(Market market, Interval interval, Instant ts) {
        PartitionKey key = PartitionKey.of(market, interval);
        if (!knownPartitions.contains(key)) {
            return Optional.empty();
        }
        try {
            return repo.findLatestAtOrBefore(key, ts);
        } catch (StorageUnavailableException e) {
            metrics.recordStorageFailure("latestBefore");
            throw e;
        }
    }

    /**
     * Raw ticks with {@code from <= timestamp < to}.
     */
    public List<PriceTick> ticks(Market market, Instant from, Instant to) {
        if (!knownTickMarkets.contains(market)) {
            return List.of();
        }
        return repo.findTicks(market, from, to);
    }

    /**
     * Delete ticks older than the cutoff.
     */
    public int purgeTicks(Market market, Instant cutoff) {
        if (!knownTickMarkets.contains(market)) {
            return 0;
        }
        int deleted = repo.deleteTicksOlderThan(market, cutoff);
        metrics.recordTicksPurged(market, deleted);
        return deleted;
    }
}
