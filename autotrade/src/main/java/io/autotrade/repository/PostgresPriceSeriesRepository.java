package io.autotrade.repository;

import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL implementation of PriceSeriesRepository.
 *
 * One table per (market, interval) partition and one tick table per market.
 * Table names are built only from validated {@link Market} fields, so quoting
 * them as identifiers is enough.
 */
public final class PostgresPriceSeriesRepository implements PriceSeriesRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresPriceSeriesRepository.class);

    private static final String BAR_COLUMNS = "\"timestamp\", open, high, low, close, volume";

    private final DataSource dataSource;

    public PostgresPriceSeriesRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void ensurePartition(PartitionKey key) {
        String sql = """
            CREATE TABLE IF NOT EXISTS %s (
                "timestamp" TIMESTAMPTZ PRIMARY KEY,
                open        NUMERIC(24, 8) NOT NULL,
                high        NUMERIC(24, 8) NOT NULL,
                low         NUMERIC(24, 8) NOT NULL,
                close       NUMERIC(24, 8) NOT NULL,
                volume      NUMERIC(24, 8) NOT NULL,
                CHECK (volume > 0),
                CHECK ("timestamp" <= NOW()),
                CHECK (low <= open AND low <= close AND open <= high AND close <= high),
                CHECK (CAST(EXTRACT(EPOCH FROM "timestamp") AS BIGINT) %% %d = 0)
            )
            """.formatted(quote(key.tableName()), key.interval().seconds());

        execute("create partition " + key.tableName(), sql);
        log.info("Partition ready: {}", key.tableName());
    }

    @Override
    public void ensureTickPartition(Market market) {
        String table = PartitionKey.tickTableName(market);
        String sql = """
            CREATE TABLE IF NOT EXISTS %s (
                tick_id     BIGSERIAL PRIMARY KEY,
                "timestamp" TIMESTAMPTZ NOT NULL,
                price       NUMERIC(24, 8) NOT NULL,
                volume      NUMERIC(24, 8) NOT NULL,
                CHECK (price > 0),
                CHECK (volume > 0),
                CHECK ("timestamp" <= NOW())
            )
            """.formatted(quote(table));
        String index = "CREATE INDEX IF NOT EXISTS %s ON %s (\"timestamp\")"
            .formatted(quote(table + "_ts"), quote(table));

        execute("create tick table " + table, sql, index);
        log.info("Tick table ready: {}", table);
    }

    @Override
    public Set<PartitionKey> discoverPartitions() {
        Set<PartitionKey> result = new HashSet<>();
        for (String table : listPriceTables()) {
            PartitionKey.parse(table).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public Set<Market> discoverTickMarkets() {
        Set<Market> result = new HashSet<>();
        for (String table : listPriceTables()) {
            PartitionKey.parseTickTable(table).ifPresent(result::add);
        }
        return result;
    }

    private List<String> listPriceTables() {
        String sql = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = 'public'
              AND table_type = 'BASE TABLE'
              AND table_name LIKE 'PriceData\\_%'
            """;
        List<String> tables = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                tables.add(rs.getString(1));
            }

        } catch (SQLException e) {
            log.error("Failed to list price tables: {}", e.getMessage());
            throw JdbcErrors.translate("list partitions", e);
        }

        return tables;
    }

    @Override
    public Optional<OhlcvBar> insertIfAbsent(OhlcvBar bar) {
        PartitionKey key = bar.partition();
        String insert = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT ("timestamp") DO NOTHING
            """.formatted(quote(key.tableName()), BAR_COLUMNS);
        String select = "SELECT %s FROM %s WHERE \"timestamp\" = ?"
            .formatted(BAR_COLUMNS, quote(key.tableName()));

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                ps.setTimestamp(1, Timestamp.from(bar.periodStart()));
                ps.setBigDecimal(2, bar.open());
                ps.setBigDecimal(3, bar.high());
                ps.setBigDecimal(4, bar.low());
                ps.setBigDecimal(5, bar.close());
                ps.setBigDecimal(6, bar.volume());

                if (ps.executeUpdate() > 0) {
                    return Optional.empty();
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(select)) {
                ps.setTimestamp(1, Timestamp.from(bar.periodStart()));
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(mapBar(key, rs));
                    }
                }
            }
            throw new SQLException("Conflicting row vanished for " + key.tableName() + " @ " + bar.periodStart());

        } catch (SQLException e) {
            log.error("Failed to insert bar into {}: {}", key.tableName(), e.getMessage());
            throw JdbcErrors.translate("insert bar", e);
        }
    }

    @Override
    public List<OhlcvBar> findRange(PartitionKey key, Instant from, Instant to, Instant afterExclusive, int limit) {
        String sql = """
            SELECT %s
            FROM %s
            WHERE "timestamp" >= ? AND "timestamp" <= ?%s
            ORDER BY "timestamp" ASC
            LIMIT ?
            """.formatted(BAR_COLUMNS, quote(key.tableName()),
                afterExclusive != null ? " AND \"timestamp\" > ?" : "");

        List<OhlcvBar> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setTimestamp(i++, Timestamp.from(from));
            ps.setTimestamp(i++, Timestamp.from(to));
            if (afterExclusive != null) {
                ps.setTimestamp(i++, Timestamp.from(afterExclusive));
            }
            ps.setInt(i, limit);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapBar(key, rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find bars in {}: {}", key.tableName(), e.getMessage());
            throw JdbcErrors.translate("find bars", e);
        }

        return result;
    }

    @Override
    public Optional<OhlcvBar> findLatestAtOrBefore(PartitionKey key, Instant at) {
        String sql = """
            SELECT %s
            FROM %s
            WHERE "timestamp" <= ?
            ORDER BY "timestamp" DESC
            LIMIT 1
            """.formatted(BAR_COLUMNS, quote(key.tableName()));

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(at));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapBar(key, rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            log.error("Failed to find latest bar in {}: {}", key.tableName(), e.getMessage());
            throw JdbcErrors.translate("find latest bar", e);
        }
    }

    @Override
    public void appendTick(PriceTick tick) {
        String table = PartitionKey.tickTableName(tick.market());
        String sql = "INSERT INTO %s (\"timestamp\", price, volume) VALUES (?, ?, ?)".formatted(quote(table));

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(tick.timestamp()));
            ps.setBigDecimal(2, tick.price());
            ps.setBigDecimal(3, tick.volume());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to append tick to {}: {}", table, e.getMessage());
            throw JdbcErrors.translate("append tick", e);
        }
    }

    @Override
    public List<PriceTick> findTicks(Market market, Instant from, Instant to) {
        String table = PartitionKey.tickTableName(market);
        String sql = """
            SELECT "timestamp", price, volume
            FROM %s
            WHERE "timestamp" >= ? AND "timestamp" < ?
            ORDER BY "timestamp" ASC, tick_id ASC
            """.formatted(quote(table));

        List<PriceTick> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(from));
            ps.setTimestamp(2, Timestamp.from(to));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new PriceTick(market,
                        rs.getTimestamp("timestamp").toInstant(),
                        rs.getBigDecimal("price"),
                        rs.getBigDecimal("volume")));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find ticks in {}: {}", table, e.getMessage());
            throw JdbcErrors.translate("find ticks", e);
        }

        return result;
    }

    @Override
    public int deleteTicksOlderThan(Market market, Instant cutoff) {
        String table = PartitionKey.tickTableName(market);
        String sql = "DELETE FROM %s WHERE \"timestamp\" < ?".formatted(quote(table));

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            int deleted = ps.executeUpdate();
            log.debug("Deleted {} ticks older than {} from {}", deleted, cutoff, table);
            return deleted;

        } catch (SQLException e) {
            log.error("Failed to delete old ticks from {}: {}", table, e.getMessage());
            throw JdbcErrors.translate("delete ticks", e);
        }
    }

    private void execute(String operation, String... statements) {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        } catch (SQLException e) {
            log.error("Failed to {}: {}", operation, e.getMessage());
            throw JdbcErrors.translate(operation, e);
        }
    }

    private OhlcvBar mapBar(PartitionKey key, ResultSet rs) throws SQLException {
        return new OhlcvBar(
            key.market(),
            key.interval(),
            rs.getTimestamp("timestamp").toInstant(),
            rs.getBigDecimal("open"),
            rs.getBigDecimal("high"),
            rs.getBigDecimal("low"),
            rs.getBigDecimal("close"),
            rs.getBigDecimal("volume")
        );
    }

    private static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }
}
