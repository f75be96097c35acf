package io.autotrade.repository;

import io.autotrade.domain.common.NotFoundException;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory PriceSeriesRepository for backtests without a database.
 *
 * Bars live in a sorted map per partition; {@code putIfAbsent} gives the
 * same per-bar atomicity as {@code ON CONFLICT DO NOTHING}.
 */
public class InMemoryPriceSeriesRepository implements PriceSeriesRepository {

    private final Map<PartitionKey, ConcurrentSkipListMap<Instant, OhlcvBar>> partitions = new ConcurrentHashMap<>();
    private final Map<Market, ConcurrentLinkedQueue<StoredTick>> ticks = new ConcurrentHashMap<>();
    private final AtomicLong tickSequence = new AtomicLong();

    @Override
    public void ensurePartition(PartitionKey key) {
        partitions.computeIfAbsent(key, k -> new ConcurrentSkipListMap<>());
    }

    @Override
    public void ensureTickPartition(Market market) {
        ticks.computeIfAbsent(market, m -> new ConcurrentLinkedQueue<>());
    }

    @Override
    public Set<PartitionKey> discoverPartitions() {
        return Set.copyOf(partitions.keySet());
    }

    @Override
    public Set<Market> discoverTickMarkets() {
        return Set.copyOf(ticks.keySet());
    }

    @Override
    public Optional<OhlcvBar> insertIfAbsent(OhlcvBar bar) {
        ConcurrentSkipListMap<Instant, OhlcvBar> partition = partitions.get(bar.partition());
        if (partition == null) {
            throw new NotFoundException("Partition", bar.partition().tableName());
        }
        return Optional.ofNullable(partition.putIfAbsent(bar.periodStart(), bar));
    }

    @Override
    public List<OhlcvBar> findRange(PartitionKey key, Instant from, Instant to, Instant afterExclusive, int limit) {
        ConcurrentSkipListMap<Instant, OhlcvBar> partition = partitions.get(key);
        if (partition == null || from.isAfter(to)) {
            return List.of();
        }
        NavigableMap<Instant, OhlcvBar> window = partition.subMap(from, true, to, true);
        if (afterExclusive != null) {
            if (!afterExclusive.isBefore(to)) {
                return List.of();
            }
            window = afterExclusive.isBefore(from) ? window : window.tailMap(afterExclusive, false);
        }
        List<OhlcvBar> page = new ArrayList<>(Math.min(limit, 256));
        for (OhlcvBar bar : window.values()) {
            if (page.size() >= limit) break;
            page.add(bar);
        }
        return page;
    }

    @Override
    public Optional<OhlcvBar> findLatestAtOrBefore(PartitionKey key, Instant at) {
        ConcurrentSkipListMap<Instant, OhlcvBar> partition = partitions.get(key);
        if (partition == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, OhlcvBar> entry = partition.floorEntry(at);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    @Override
    public void appendTick(PriceTick tick) {
        ConcurrentLinkedQueue<StoredTick> queue = ticks.get(tick.market());
        if (queue == null) {
            throw new NotFoundException("Partition", PartitionKey.tickTableName(tick.market()));
        }
        queue.add(new StoredTick(tickSequence.incrementAndGet(), tick));
    }

    @Override
    public List<PriceTick> findTicks(Market market, Instant from, Instant to) {
        ConcurrentLinkedQueue<StoredTick> queue = ticks.get(market);
        if (queue == null) {
            return List.of();
        }
        return queue.stream()
            .filter(t -> !t.tick().timestamp().isBefore(from) && t.tick().timestamp().isBefore(to))
            .sorted(Comparator.comparing((StoredTick t) -> t.tick().timestamp()).thenComparingLong(StoredTick::seq))
            .map(StoredTick::tick)
            .toList();
    }

    @Override
    public int deleteTicksOlderThan(Market market, Instant cutoff) {
        ConcurrentLinkedQueue<StoredTick> queue = ticks.get(market);
        if (queue == null) {
            return 0;
        }
        AtomicInteger deleted = new AtomicInteger();
        queue.removeIf(t -> {
            boolean old = t.tick().timestamp().isBefore(cutoff);
            if (old) deleted.incrementAndGet();
            return old;
        });
        return deleted.get();
    }

    private record StoredTick(long seq, PriceTick tick) {}
}
