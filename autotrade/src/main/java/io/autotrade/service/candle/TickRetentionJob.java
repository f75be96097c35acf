package io.autotrade.service.candle;

import io.autotrade.domain.common.StorageUnavailableException;
import io.autotrade.domain.market.Market;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Deletes raw ticks older than the retention TTL, one market at a time.
 * Bars are never touched.
 */
public final class TickRetentionJob {
    private static final Logger log = LoggerFactory.getLogger(TickRetentionJob.class);

    private final PriceSeriesStore store;
    private final Duration ttl;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> task;

    public TickRetentionJob(PriceSeriesStore store, Duration ttl, ScheduledExecutorService scheduler) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Tick retention must be positive: " + ttl);
        }
        this.store = store;
        this.ttl = ttl;
        this.scheduler = scheduler;
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * One purge pass over every market with a tick table.
     * A storage outage on one market is logged and the pass moves on.
     *
     * @return total ticks deleted
     */
    public int runOnce() {
        Instant cutoff = store.getClock().instant().minus(ttl);
        int total = 0;
        for (Market market : store.tickMarkets()) {
            try {
                int deleted = store.purgeTicks(market, cutoff);
                if (deleted > 0) {
                    log.info("Purged {} ticks older than {} for {}", deleted, cutoff, market);
                }
                total += deleted;
            } catch (StorageUnavailableException e) {
                log.warn("Tick purge for {} skipped: {}", market, e.getMessage());
            }
        }
        return total;
    }

    /**
     * Run {@link #runOnce()} at a fixed rate until {@link #stop()}.
     */
    public synchronized void start(Duration period) {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleAtFixedRate(() -> {
            try {
                runOnce();
            } catch (RuntimeException e) {
                log.error("Tick retention pass failed: {}", e.getMessage(), e);
            }
        }, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Tick retention started: ttl={} every {}", ttl, period);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Tick retention stopped");
        }
    }
}
