package io.autotrade.repository;

import io.autotrade.domain.market.Market;
import io.autotrade.domain.market.MarketId;
import io.autotrade.domain.market.RegisteredMarket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of MarketRepository.
 */
public final class PostgresMarketRepository implements MarketRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresMarketRepository.class);

    private static final String COLUMNS = "market_id, exchange, base, quote, active, created_at";

    private final DataSource dataSource;

    public PostgresMarketRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create the markets table if missing.
     */
    public void createSchema() {
        String sql = """
            CREATE TABLE IF NOT EXISTS markets (
                market_id  BIGSERIAL PRIMARY KEY,
                exchange   VARCHAR(16) NOT NULL,
                base       VARCHAR(10) NOT NULL,
                quote      VARCHAR(10) NOT NULL,
                active     BOOLEAN NOT NULL DEFAULT TRUE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                UNIQUE (exchange, base, quote)
            )
            """;

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute(sql);
            log.info("Markets table ready");
        } catch (SQLException e) {
            log.error("Failed to create markets table: {}", e.getMessage());
            throw JdbcErrors.translate("create markets table", e);
        }
    }

    @Override
    public RegisteredMarket findOrCreate(Market market) {
        // The no-op update makes RETURNING yield the row on conflict too
        String sql = """
            INSERT INTO markets (exchange, base, quote)
            VALUES (?, ?, ?)
            ON CONFLICT (exchange, base, quote)
            DO UPDATE SET exchange = EXCLUDED.exchange
            RETURNING market_id, exchange, base, quote, active, created_at
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, market.exchange());
            ps.setString(2, market.base());
            ps.setString(3, market.quote());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return mapRow(rs);
                }
            }
            throw new SQLException("INSERT ... RETURNING produced no row for " + market.key());

        } catch (SQLException e) {
            log.error("Failed to register market {}: {}", market.key(), e.getMessage());
            throw JdbcErrors.translate("register market", e);
        }
    }

    @Override
    public Optional<RegisteredMarket> findById(MarketId id) {
        String sql = "SELECT " + COLUMNS + " FROM markets WHERE market_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id.value());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            log.error("Failed to find market {}: {}", id, e.getMessage());
            throw JdbcErrors.translate("find market", e);
        }
    }

    @Override
    public Optional<RegisteredMarket> findByMarket(Market market) {
        String sql = "SELECT " + COLUMNS + " FROM markets WHERE exchange = ? AND base = ? AND quote = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, market.exchange());
            ps.setString(2, market.base());
            ps.setString(3, market.quote());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }

        } catch (SQLException e) {
            log.error("Failed to find market {}: {}", market.key(), e.getMessage());
            throw JdbcErrors.translate("find market", e);
        }
    }

    @Override
    public List<RegisteredMarket> findAll() {
        String sql = "SELECT " + COLUMNS + " FROM markets ORDER BY market_id ASC";
        List<RegisteredMarket> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to list markets: {}", e.getMessage());
            throw JdbcErrors.translate("list markets", e);
        }

        return result;
    }

    @Override
    public boolean setActive(MarketId id, boolean active) {
        String sql = "UPDATE markets SET active = ? WHERE market_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, active);
            ps.setLong(2, id.value());
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Failed to update market {}: {}", id, e.getMessage());
            throw JdbcErrors.translate("update market", e);
        }
    }

    private RegisteredMarket mapRow(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new RegisteredMarket(
            new MarketId(rs.getLong("market_id")),
            Market.of(rs.getString("base"), rs.getString("quote"), rs.getString("exchange")),
            rs.getBoolean("active"),
            created != null ? created.toInstant() : Instant.EPOCH
        );
    }
}
