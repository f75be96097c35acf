package io.autotrade.feed;

import io.autotrade.domain.common.PriceBaseException;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.infrastructure.metrics.IngestionMetrics;
import io.autotrade.service.candle.IngestResult;
import io.autotrade.service.candle.PriceSeriesStore;
import io.autotrade.service.candle.TickAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ingestion Pipeline - bounded queue between feed producers and the store.
 *
 * Pattern:
 * - Producers (one crawler per exchange/market) call onTick/onBar
 * - Events wait in a bounded ArrayBlockingQueue; a full queue blocks the producer
 * - Consumer threads hand ticks to the aggregator, which appends them to the
 *   store only when every bucket lookup has succeeded; bars go to the store
 * - A tick that fails (conflict, storage outage) leaves neither a stored tick
 *   nor a bucket change, so the producer can retry it
 * - The returned future carries the outcome back to the producer, including
 *   ConflictException and StorageUnavailableException (no retries here)
 *
 * On stop, events already queued are drained before the consumers exit.
 */
public final class IngestionPipeline implements MarketFeedListener {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private record Event(PriceTick tick, OhlcvBar bar, CompletableFuture<Object> result) {}

    private final PriceSeriesStore store;
    private final TickAggregator aggregator;
    private final IngestionMetrics metrics;
    private final BlockingQueue<Event> queue;
    private final int consumers;

    private volatile boolean running = false;
    private ExecutorService executor;

    public IngestionPipeline(PriceSeriesStore store, TickAggregator aggregator, IngestionMetrics metrics,
                             int capacity, int consumers) {
        if (capacity <= 0 || consumers <= 0) {
            throw new IllegalArgumentException("capacity and consumers must be positive");
        }
        this.store = store;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.consumers = consumers;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        AtomicInteger threadNo = new AtomicInteger();
        executor = Executors.newFixedThreadPool(consumers, r -> {
            Thread t = new Thread(r, "IngestConsumer-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < consumers; i++) {
            executor.submit(this::consume);
        }
        log.info("Ingestion pipeline started: {} consumers, capacity {}", consumers, queue.remainingCapacity() + queue.size());
    }

    /**
     * Stop accepting events, drain the queue and wait for consumers.
     *
     * @return true if all consumers finished within the timeout
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        synchronized (this) {
            if (!running) {
                return true;
            }
            running = false;
            executor.shutdown();
        }
        boolean finished = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (finished) {
            // events that slipped in while the consumers were exiting
            Event leftover;
            while ((leftover = queue.poll()) != null) {
                leftover.result().completeExceptionally(new IllegalStateException("Ingestion pipeline stopped"));
            }
        }
        if (!finished) {
            log.warn("Ingestion consumers still busy after {}, {} events queued", timeout, queue.size());
        } else {
            log.info("Ingestion pipeline stopped");
        }
        return finished;
    }

    public boolean isRunning() {
        return running;
    }

    public int queueDepth() {
        return queue.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // Producer side
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<Void> onTick(PriceTick tick) {
        return submit(new Event(tick, null, new CompletableFuture<>())).thenApply(r -> null);
    }

    @Override
    public CompletableFuture<IngestResult> onBar(OhlcvBar bar) {
        return submit(new Event(null, bar, new CompletableFuture<>())).thenApply(IngestResult.class::cast);
    }

    private CompletableFuture<Object> submit(Event event) {
        if (!running) {
            event.result().completeExceptionally(new IllegalStateException("Ingestion pipeline is not running"));
            return event.result();
        }
        try {
            queue.put(event);
            metrics.recordQueueDepth(queue.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            event.result().completeExceptionally(e);
        }
        return event.result();
    }

    // ═══════════════════════════════════════════════════════════════
    // Consumer side
    // ═══════════════════════════════════════════════════════════════

    private void consume() {
        while (running || !queue.isEmpty()) {
            Event event;
            try {
                event = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Ingestion consumer interrupted, {} events left", queue.size());
                return;
            }
            if (event == null) {
                continue;
            }
            metrics.recordQueueDepth(queue.size());
            process(event);
        }
    }

    private void process(Event event) {
        try {
            if (event.tick() != null) {
                // appended only once aggregation has accepted the tick
                aggregator.accept(event.tick(), store::ingestTick);
                event.result().complete(null);
            } else {
                event.result().complete(store.ingestBar(event.bar()));
            }
        } catch (PriceBaseException e) {
            log.debug("Ingestion failed: {}", e.getMessage());
            event.result().completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("Unexpected ingestion failure: {}", e.getMessage(), e);
            event.result().completeExceptionally(e);
        }
    }
}
