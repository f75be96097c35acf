package io.autotrade.infrastructure.metrics;

import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.market.Market;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of IngestionMetrics.
 *
 * Key Metrics:
 * - pricebase_bars_total{partition, outcome} - Bar ingestions by outcome
 * - pricebase_ticks_total{market, status} - Accepted/rejected ticks
 * - pricebase_late_ticks_total{market, action} - Ticks after finalization
 * - pricebase_storage_failures_total{operation} - Transient storage errors
 * - pricebase_ticks_purged_total{market} - Ticks removed by retention
 * - pricebase_ingest_queue_depth - Events waiting in the pipeline
 */
public class PrometheusIngestionMetrics implements IngestionMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusIngestionMetrics.class);

    private final CollectorRegistry registry;

    private final Counter barCounter;
    private final Counter tickCounter;
    private final Counter lateTickCounter;
    private final Counter storageFailureCounter;
    private final Counter purgedTickCounter;
    private final Gauge queueDepth;

    public PrometheusIngestionMetrics() {
        this(new CollectorRegistry());
    }

    public PrometheusIngestionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.barCounter = Counter.build()
            .name("pricebase_bars_total")
            .help("Bar ingestions by outcome")
            .labelNames("partition", "outcome")
            .register(registry);

        this.tickCounter = Counter.build()
            .name("pricebase_ticks_total")
            .help("Tick ingestions by status")
            .labelNames("market", "status")
            .register(registry);

        this.lateTickCounter = Counter.build()
            .name("pricebase_late_ticks_total")
            .help("Ticks arriving after their bucket was finalized")
            .labelNames("market", "action")
            .register(registry);

        this.storageFailureCounter = Counter.build()
            .name("pricebase_storage_failures_total")
            .help("Transient storage failures surfaced to callers")
            .labelNames("operation")
            .register(registry);

        this.purgedTickCounter = Counter.build()
            .name("pricebase_ticks_purged_total")
            .help("Ticks removed by the retention job")
            .labelNames("market")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("pricebase_ingest_queue_depth")
            .help("Events waiting in the ingestion queue")
            .register(registry);

        log.info("Prometheus ingestion metrics initialized");
    }

    @Override
    public void recordBar(PartitionKey key, String outcome) {
        barCounter.labels(key.tableName(), outcome).inc();
    }

    @Override
    public void recordTick(Market market, boolean accepted) {
        tickCounter.labels(market.key(), accepted ? "accepted" : "rejected").inc();
    }

    @Override
    public void recordLateTick(Market market, String action) {
        lateTickCounter.labels(market.key(), action).inc();
    }

    @Override
    public void recordStorageFailure(String operation) {
        storageFailureCounter.labels(operation).inc();
    }

    @Override
    public void recordTicksPurged(Market market, int count) {
        if (count > 0) {
            purgedTickCounter.labels(market.key()).inc(count);
        }
    }

    @Override
    public void recordQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
