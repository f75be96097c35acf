package io.autotrade.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.autotrade.config.PriceBaseConfig;
import io.autotrade.config.PriceBaseConfigLoader;
import io.autotrade.domain.common.PriceBaseException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.market.Market;
import io.autotrade.feed.FeedPayloadMapper;
import io.autotrade.feed.IngestionPipeline;
import io.autotrade.infrastructure.metrics.PrometheusIngestionMetrics;
import io.autotrade.infrastructure.retry.StorageRetry;
import io.autotrade.repository.InMemoryMarketRepository;
import io.autotrade.repository.InMemoryPriceSeriesRepository;
import io.autotrade.repository.MarketRepository;
import io.autotrade.repository.PostgresMarketRepository;
import io.autotrade.repository.PostgresPriceSeriesRepository;
import io.autotrade.repository.PriceSeriesRepository;
import io.autotrade.service.backtest.BacktestResult;
import io.autotrade.service.backtest.NaiveBacktester;
import io.autotrade.service.candle.BarCsvImporter;
import io.autotrade.service.candle.BarResampler;
import io.autotrade.service.candle.PriceSeriesStore;
import io.autotrade.service.candle.TickAggregator;
import io.autotrade.service.candle.TickRetentionJob;
import io.autotrade.service.market.MarketRegistry;
import io.autotrade.service.signal.RollingAverageCalculator;
import io.autotrade.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point.
 *
 * Modes:
 * <pre>
 * serve                                                         (default) ingest JSON feed lines from stdin
 * import   &lt;csv&gt; &lt;exchange&gt; &lt;base&gt; &lt;quote&gt; &lt;minutes&gt;             bulk-load bars
 * backfill &lt;exchange&gt; &lt;base&gt; &lt;quote&gt; &lt;src&gt; &lt;dst&gt; &lt;from&gt; &lt;to&gt;   resample stored bars
 * backtest &lt;exchange&gt; &lt;base&gt; &lt;quote&gt; &lt;minutes&gt; &lt;from&gt; &lt;to&gt; &lt;capital&gt;
 * </pre>
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== AutoTrade PriceBase Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        PriceBaseConfig config = PriceBaseConfigLoader.load();
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Storage
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        MarketRepository marketRepo;
        PriceSeriesRepository seriesRepo;
        if (config.usesDatabase()) {
            dataSource = createDataSource(config);
            PostgresMarketRepository postgresMarkets = new PostgresMarketRepository(dataSource);
            postgresMarkets.createSchema();
            marketRepo = postgresMarkets;
            seriesRepo = new PostgresPriceSeriesRepository(dataSource);
        } else {
            log.info("DB: none configured, using in-memory storage");
            marketRepo = new InMemoryMarketRepository(clock);
            seriesRepo = new InMemoryPriceSeriesRepository();
        }

        PrometheusIngestionMetrics metrics = new PrometheusIngestionMetrics();
        StorageRetry retry = new StorageRetry(config::retryPolicy);

        MarketRegistry registry = new MarketRegistry(marketRepo);
        PriceSeriesStore store = new PriceSeriesStore(seriesRepo, clock, metrics, config.pageSize());

        // ═══════════════════════════════════════════════════════════════
        // Partition discovery
        // ═══════════════════════════════════════════════════════════════
        registry.adopt(retry.call("refreshPartitions", store::refreshPartitions));

        String mode = args.length > 0 ? args[0] : "serve";
        try {
            switch (mode) {
                case "import" -> runImport(args, store);
                case "backfill" -> runBackfill(args, store);
                case "backtest" -> runBacktest(args, store, config, clock);
                case "serve" -> serve(config, store, registry, metrics);
                default -> {
                    log.error("Unknown mode '{}' (expected serve, import, backfill or backtest)", mode);
                    System.exit(2);
                }
            }
        } finally {
            if (dataSource != null) {
                dataSource.close();
            }
        }
    }

    private static void serve(PriceBaseConfig config, PriceSeriesStore store, MarketRegistry registry,
                              PrometheusIngestionMetrics metrics) throws InterruptedException {
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "PriceBaseScheduler");
            t.setDaemon(true);
            return t;
        });

        TickAggregator aggregator = new TickAggregator(store, config.intervals(), config.gracePeriod(),
            config.latePolicy(), scheduler, metrics);
        log.info("✓ Aggregating ticks into {} (grace {}, late ticks: {})",
            aggregator.getIntervals(), config.gracePeriod(), config.latePolicy());

        IngestionPipeline pipeline = new IngestionPipeline(store, aggregator, metrics,
            config.queueCapacity(), config.ingestConsumers());
        pipeline.start();

        scheduler.scheduleAtFixedRate(() -> {
            try {
                aggregator.finalizeDue(store.getClock().instant());
            } catch (RuntimeException e) {
                log.error("Finalization pass failed: {}", e.getMessage(), e);
            }
        }, 1, 1, TimeUnit.SECONDS);

        startFeedReader(new FeedPayloadMapper(registry), pipeline);

        TickRetentionJob retention = new TickRetentionJob(store, config.tickRetention(), scheduler);
        retention.start(config.retentionCheckPeriod());

        Duration shutdownTimeout = Env.getDuration("SHUTDOWN_TIMEOUT", Duration.ofSeconds(10));
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            try {
                pipeline.stop(shutdownTimeout);
                aggregator.flushAll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping ingestion");
            } finally {
                retention.stop();
                scheduler.shutdownNow();
                stopped.countDown();
            }
        }, "PriceBaseShutdown"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== PriceBase ready ===");
        log.info("═══════════════════════════════════════════════════════════════");
        stopped.await();
    }

    /**
     * Crawlers pipe newline-delimited JSON payloads into stdin.
     */
    private static void startFeedReader(FeedPayloadMapper mapper, IngestionPipeline pipeline) {
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        mapper.dispatch(line, pipeline).whenComplete((result, error) -> {
                            if (error != null) {
                                log.warn("Feed event not stored: {}", error.getMessage());
                            }
                        });
                    } catch (PriceBaseException e) {
                        log.warn("Skipped feed payload: {}", e.getMessage());
                    }
                }
                log.info("Feed input closed");
            } catch (IOException e) {
                log.error("Failed to read feed input: {}", e.getMessage(), e);
            }
        }, "FeedReader");
        reader.setDaemon(true);
        reader.start();
    }

    private static void runImport(String[] args, PriceSeriesStore store) throws IOException {
        requireArgs(args, 6, "import <csv> <exchange> <base> <quote> <minutes>");
        Market market = Market.of(args[3], args[4], args[2]);
        BarCsvImporter.ImportReport report = new BarCsvImporter(store)
            .importFile(Path.of(args[1]), market, Interval.ofMinutes(Integer.parseInt(args[5])));
        log.info("Import done: {}", report);
    }

    private static void runBackfill(String[] args, PriceSeriesStore store) {
        requireArgs(args, 8, "backfill <exchange> <base> <quote> <src> <dst> <from> <to>");
        Market market = Market.of(args[2], args[3], args[1]);
        BarResampler.BackfillReport report = new BarResampler(store).backfill(market,
            Interval.ofMinutes(Integer.parseInt(args[4])), Interval.ofMinutes(Integer.parseInt(args[5])),
            Instant.parse(args[6]), Instant.parse(args[7]));
        log.info("Backfill done: {}", report);
    }

    private static void runBacktest(String[] args, PriceSeriesStore store, PriceBaseConfig config, Clock clock) {
        requireArgs(args, 8, "backtest <exchange> <base> <quote> <minutes> <from> <to> <capital>");
        Market market = Market.of(args[2], args[3], args[1]);
        RollingAverageCalculator indicator = new RollingAverageCalculator(store, config.indicatorMinPeriods());
        BacktestResult result = new NaiveBacktester(indicator, clock).run(market,
            Interval.ofMinutes(Integer.parseInt(args[4])), Instant.parse(args[5]), Instant.parse(args[6]),
            config.priceField(), config.indicatorWindow(), new BigDecimal(args[7]));
        log.info("Backtest done: {} periods, {} round trips, final balance {} {}, final P/L {}",
            result.steps().size(), result.trades(), result.finalBalance().toPlainString(), market.base(),
            result.finalPnl().toPlainString());
    }

    private static void requireArgs(String[] args, int count, String usage) {
        if (args.length < count) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }

    private static HikariDataSource createDataSource(PriceBaseConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("pricebase-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
