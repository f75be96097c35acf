package io.autotrade.repository;

import io.autotrade.domain.common.StorageUnavailableException;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.market.MarketId;
import io.autotrade.domain.market.RegisteredMarket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostgresMarketRepositoryTest {

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection conn;
    @Mock
    private PreparedStatement ps;
    @Mock
    private ResultSet rs;

    private PostgresMarketRepository repo;

    @BeforeEach
    void setUp() {
        repo = new PostgresMarketRepository(dataSource);
    }

    @Test
    void findOrCreate_mapsReturnedRow() throws SQLException {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getLong("market_id")).thenReturn(7L);
        when(rs.getString("exchange")).thenReturn("Bitfinex");
        when(rs.getString("base")).thenReturn("USD");
        when(rs.getString("quote")).thenReturn("BTC");
        when(rs.getBoolean("active")).thenReturn(true);
        when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(created));

        RegisteredMarket record = repo.findOrCreate(Market.of("usd", "btc", "bitfinex"));

        assertEquals(new MarketId(7), record.id());
        assertEquals(Market.of("USD", "BTC", "Bitfinex"), record.market());
        assertTrue(record.active());
        assertEquals(created, record.registeredAt());
        verify(ps).setString(1, "Bitfinex");
        verify(ps).setString(2, "USD");
        verify(ps).setString(3, "BTC");
    }

    @Test
    void setActive_reportsMissingRow() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeUpdate()).thenReturn(0);

        assertFalse(repo.setActive(new MarketId(99), false));
        verify(ps).setBoolean(1, false);
        verify(ps).setLong(2, 99L);
    }

    @Test
    void findById_translatesTimeout() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString())).thenThrow(new SQLException("timeout", "57014"));

        assertThrows(StorageUnavailableException.class, () -> repo.findById(new MarketId(1)));
    }
}
