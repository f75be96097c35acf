package io.autotrade.service.candle;

import io.autotrade.domain.common.ConflictException;
import io.autotrade.domain.common.PriceBaseException;
import io.autotrade.domain.common.StorageUnavailableException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;
import io.autotrade.infrastructure.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Tick Aggregator - builds OHLCV bars from raw ticks at every configured interval.
 *
 * Pattern:
 * - Ticks land in open buckets keyed by (market, interval, periodStart),
 *   periodStart = epoch floor of the tick timestamp
 * - Ticks may arrive out of order: open is the price of the earliest tick,
 *   close the price of the latest, regardless of arrival order
 * - A bucket stays open until finalizeBucket() or until its grace period
 *   has elapsed, then the bar is written through the PriceSeriesStore
 * - A tick for an already stored bucket is handled by the LateTickPolicy
 *
 * Bucket state for one (market, interval) is guarded by a partition lock,
 * so accept() and finalize never interleave on the same bucket. accept()
 * takes the locks of all intervals in ascending interval order.
 */
public final class TickAggregator {
    private static final Logger log = LoggerFactory.getLogger(TickAggregator.class);

    /**
     * Identity of one aggregation bucket.
     */
    public record BucketKey(Market market, Interval interval, Instant periodStart) {
        public static BucketKey of(PriceTick tick, Interval interval) {
            return new BucketKey(tick.market(), interval, interval.floor(tick.timestamp()));
        }

        public PartitionKey partition() {
            return PartitionKey.of(market, interval);
        }

        public Instant periodEnd() {
            return periodStart.plusSeconds(interval.seconds());
        }
    }

    private final PriceSeriesStore store;
    private final List<Interval> intervals;
    private final Duration gracePeriod;
    private final LateTickPolicy latePolicy;
    private final ScheduledExecutorService scheduler;
    private final IngestionMetrics metrics;
    private final PartitionLocks locks = new PartitionLocks();

    private final Map<BucketKey, Bucket> buckets = new ConcurrentHashMap<>();

    public TickAggregator(
        PriceSeriesStore store,
        Collection<Interval> intervals,
        Duration gracePeriod,
        LateTickPolicy latePolicy,
        ScheduledExecutorService scheduler,
        IngestionMetrics metrics
    ) {
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("At least one aggregation interval is required");
        }
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("Grace period cannot be negative: " + gracePeriod);
        }
        this.store = store;
        this.intervals = intervals.stream().distinct().sorted(Comparator.comparingInt(Interval::minutes)).toList();
        this.gracePeriod = gracePeriod;
        this.latePolicy = latePolicy;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    public List<Interval> getIntervals() {
        return intervals;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public LateTickPolicy getLatePolicy() {
        return latePolicy;
    }

    // ═══════════════════════════════════════════════════════════════
    // Accumulation
    // ═══════════════════════════════════════════════════════════════

    /**
     * Add a tick to the open bucket of every configured interval.
     *
     * @see #accept(PriceTick, Consumer)
     */
    public int accept(PriceTick tick) {
        return accept(tick, t -> { });
    }

    /**
     * Add a tick to the open bucket of every configured interval, running
     * {@code commit} (typically the tick append) once the tick is known to be
     * accepted and before any bucket changes.
     *
     * The partition locks of all intervals are held for the whole call, and
     * every stored-bar lookup happens before {@code commit}. A failed lookup or
     * a failing {@code commit} therefore leaves every bucket as it was, and the
     * caller may retry the same tick.
     *
     * Under DROP a tick that is late for one interval still counts toward the
     * open buckets of the others. Under REJECT a tick late for any interval is
     * refused as a whole: {@code commit} does not run and no bucket changes.
     *
     * @return number of buckets the tick was added to
     * @throws ConflictException           under REJECT, if the tick falls into an already stored bar
     * @throws StorageUnavailableException if a stored-bar lookup fails
     */
    public int accept(PriceTick tick, Consumer<PriceTick> commit) {
        List<BucketKey> keys = intervals.stream().map(interval -> BucketKey.of(tick, interval)).toList();
        List<PartitionKey> partitions = keys.stream().map(BucketKey::partition).toList();
        return locks.withLocks(partitions, () -> acceptLocked(tick, keys, commit));
    }

    private int acceptLocked(PriceTick tick, List<BucketKey> keys, Consumer<PriceTick> commit) {
        Map<BucketKey, OhlcvBar> late = new LinkedHashMap<>();
        for (BucketKey key : keys) {
            if (!buckets.containsKey(key)) {
                storedBar(key).ifPresent(bar -> late.put(key, bar));
            }
        }

        if (!late.isEmpty() && latePolicy == LateTickPolicy.REJECT) {
            late.keySet().forEach(key -> metrics.recordLateTick(tick.market(), "rejected"));
            OhlcvBar existing = late.values().iterator().next();
            throw new ConflictException(existing, mergeInto(existing, tick));
        }

        commit.accept(tick);

        int added = 0;
        for (BucketKey key : keys) {
            if (late.containsKey(key)) {
                metrics.recordLateTick(tick.market(), "dropped");
                log.warn("Dropped late tick for finalized bar {} @ {}: price={} volume={}",
                    key.partition(), key.periodStart(), tick.price().toPlainString(), tick.volume().toPlainString());
                continue;
            }
            buckets.computeIfAbsent(key, k -> {
                log.debug("Opened bucket {} @ {}", k.partition(), k.periodStart());
                return new Bucket();
            }).add(tick);
            added++;
        }
        return added;
    }

    private Optional<OhlcvBar> storedBar(BucketKey key) {
        return store.latestBefore(key.market(), key.interval(), key.periodStart())
            .filter(bar -> bar.periodStart().equals(key.periodStart()));
    }

    // ═══════════════════════════════════════════════════════════════
    // Finalization
    // ═══════════════════════════════════════════════════════════════

    /**
     * Close the bucket and write its bar to the store.
     *
     * On StorageUnavailableException the bucket is reopened with all its
     * ticks so that a later finalize can retry. On any other store error the
     * bucket is discarded and the error surfaces.
     *
     * @return the bar written, or empty if no bucket was open for this key
     */
    public Optional<OhlcvBar> finalizeBucket(BucketKey key) {
        return locks.withLock(key.partition(), () -> {
            Bucket bucket = buckets.remove(key);
            if (bucket == null) {
                return Optional.empty();
            }
            OhlcvBar bar = bucket.toBar(key);
            try {
                IngestResult result = store.ingestBar(bar);
                log.debug("Finalized {} @ {} from {} ticks: {}",
                    key.partition(), key.periodStart(), bucket.ticks, result);
                return Optional.of(bar);
            } catch (StorageUnavailableException e) {
                buckets.put(key, bucket);
                log.warn("Storage unavailable finalizing {} @ {}, bucket kept open", key.partition(), key.periodStart());
                throw e;
            }
        });
    }

    /**
     * Finalize every bucket whose grace period has elapsed at {@code now}.
     * Failures are logged per bucket; buckets that hit a storage outage stay open.
     *
     * @return bars written in this pass
     */
    public List<OhlcvBar> finalizeDue(Instant now) {
        List<OhlcvBar> written = new ArrayList<>();
        for (BucketKey key : List.copyOf(buckets.keySet())) {
            if (dueAt(key).isAfter(now)) {
                continue;
            }
            try {
                finalizeBucket(key).ifPresent(written::add);
            } catch (StorageUnavailableException e) {
                log.warn("Deferred finalization of {} @ {}: {}", key.partition(), key.periodStart(), e.getMessage());
            } catch (PriceBaseException e) {
                log.error("Failed to finalize {} @ {}: {}", key.partition(), key.periodStart(), e.getMessage());
            }
        }
        if (!written.isEmpty()) {
            log.info("Finalized {} bars ({} buckets still open)", written.size(), buckets.size());
        }
        return written;
    }

    /**
     * Finalize the bucket once its grace period has elapsed.
     *
     * Cancelling the returned future before the timer fires cancels the
     * timer and leaves the bucket open with all accumulated ticks. Once the
     * timer has started finalizing, cancel() returns false and the future
     * completes with the written bar.
     */
    public CompletableFuture<Optional<OhlcvBar>> finalizeAfterGrace(BucketKey key) {
        GraceFinalization result = new GraceFinalization(key);
        long delayMillis = Math.max(0, Duration.between(store.getClock().instant(), dueAt(key)).toMillis());

        result.timer = scheduler.schedule(() -> {
            if (!result.claim()) {
                return;
            }
            try {
                result.complete(finalizeBucket(key));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, delayMillis, TimeUnit.MILLISECONDS);

        if (result.isCancelled()) {
            result.timer.cancel(false);
        }
        return result;
    }

    /**
     * Pending grace-period finalization. The timer and cancel() race for one
     * claim; whichever wins decides whether the bucket is written.
     */
    private static final class GraceFinalization extends CompletableFuture<Optional<OhlcvBar>> {
        private final BucketKey key;
        private final AtomicBoolean claimed = new AtomicBoolean();
        volatile ScheduledFuture<?> timer;

        GraceFinalization(BucketKey key) {
            this.key = key;
        }

        boolean claim() {
            return claimed.compareAndSet(false, true);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (!claim()) {
                return isCancelled();
            }
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            ScheduledFuture<?> pending = timer;
            if (pending != null) {
                pending.cancel(false);
            }
            log.debug("Finalization of {} @ {} cancelled, bucket stays open", key.partition(), key.periodStart());
            return cancelled;
        }
    }

    /**
     * Finalize every open bucket regardless of grace period (shutdown path).
     */
    public List<OhlcvBar> flushAll() {
        return finalizeDue(Instant.MAX);
    }

    private Instant dueAt(BucketKey key) {
        return key.periodEnd().plus(gracePeriod);
    }

    // ═══════════════════════════════════════════════════════════════
    // Inspection
    // ═══════════════════════════════════════════════════════════════

    public List<BucketKey> openBuckets() {
        return buckets.keySet().stream()
            .sorted(Comparator.comparing(BucketKey::periodStart))
            .toList();
    }

    /**
     * Current state of an open bucket as a bar, without finalizing it.
     */
    public Optional<OhlcvBar> preview(BucketKey key) {
        return locks.withLock(key.partition(), () ->
            Optional.ofNullable(buckets.get(key)).map(bucket -> bucket.toBar(key)));
    }

    // ═══════════════════════════════════════════════════════════════
    // Pure aggregation
    // ═══════════════════════════════════════════════════════════════

    /**
     * Aggregate ticks into bars of one interval without touching storage.
     * Empty buckets produce no bar. Output is ordered by market then periodStart.
     */
    public static List<OhlcvBar> aggregate(List<PriceTick> ticks, Interval interval) {
        Map<BucketKey, Bucket> grouped = new LinkedHashMap<>();
        for (PriceTick tick : ticks) {
            grouped.computeIfAbsent(BucketKey.of(tick, interval), k -> new Bucket()).add(tick);
        }
        return grouped.entrySet().stream()
            .sorted(Map.Entry.<BucketKey, Bucket>comparingByKey(
                Comparator.comparing((BucketKey k) -> k.market().key()).thenComparing(BucketKey::periodStart)))
            .map(e -> e.getValue().toBar(e.getKey()))
            .toList();
    }

    private static OhlcvBar mergeInto(OhlcvBar existing, PriceTick tick) {
        return new OhlcvBar(existing.market(), existing.interval(), existing.periodStart(),
            existing.open(),
            existing.high().max(tick.price()),
            existing.low().min(tick.price()),
            existing.close(),
            existing.volume().add(tick.volume()));
    }

    /**
     * Mutable accumulator for one bucket. Callers hold the partition lock.
     */
    private static final class Bucket {
        Instant firstAt;
        Instant lastAt;
        BigDecimal open;
        BigDecimal close;
        BigDecimal high;
        BigDecimal low;
        BigDecimal volume = BigDecimal.ZERO;
        int ticks;

        void add(PriceTick tick) {
            Instant ts = tick.timestamp();
            BigDecimal price = tick.price();
            if (ticks == 0) {
                firstAt = ts;
                lastAt = ts;
                open = price;
                close = price;
                high = price;
                low = price;
            } else {
                // ties keep the first-arrived tick as open and the last-arrived as close
                if (ts.isBefore(firstAt)) {
                    firstAt = ts;
                    open = price;
                }
                if (!ts.isBefore(lastAt)) {
                    lastAt = ts;
                    close = price;
                }
                high = high.max(price);
                low = low.min(price);
            }
            volume = volume.add(tick.volume());
            ticks++;
        }

        OhlcvBar toBar(BucketKey key) {
            return new OhlcvBar(key.market(), key.interval(), key.periodStart(), open, high, low, close, volume);
        }
    }
}
