package io.autotrade.repository;

import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.common.StorageUnavailableException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.market.Market;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostgresPriceSeriesRepositoryTest {

    private static final Market MARKET = Market.of("USD", "BTC", "Bitfinex");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final OhlcvBar BAR = OhlcvBar.of(MARKET, Interval.ONE_MINUTE, T0, "100", "105", "99", "101", "3");

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection conn;
    @Mock
    private PreparedStatement insertPs;
    @Mock
    private PreparedStatement selectPs;
    @Mock
    private ResultSet rs;

    private PostgresPriceSeriesRepository repo;

    @BeforeEach
    void setUp() {
        repo = new PostgresPriceSeriesRepository(dataSource);
    }

    @Test
    void insertIfAbsent_returnsEmptyWhenRowInserted() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(startsWith("INSERT"))).thenReturn(insertPs);
        when(insertPs.executeUpdate()).thenReturn(1);

        Optional<OhlcvBar> existing = repo.insertIfAbsent(BAR);

        assertTrue(existing.isEmpty(), "Fresh insert reports no existing bar");
        verify(insertPs).setTimestamp(1, Timestamp.from(T0));
        verify(insertPs).setBigDecimal(2, BAR.open());
        verify(insertPs).setBigDecimal(6, BAR.volume());
        verify(conn, never()).prepareStatement(startsWith("SELECT"));
    }

    @Test
    void insertIfAbsent_returnsStoredRowOnConflict() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(startsWith("INSERT"))).thenReturn(insertPs);
        when(conn.prepareStatement(startsWith("SELECT"))).thenReturn(selectPs);
        when(insertPs.executeUpdate()).thenReturn(0);
        when(selectPs.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getTimestamp("timestamp")).thenReturn(Timestamp.from(T0));
        when(rs.getBigDecimal("open")).thenReturn(new BigDecimal("100.00000000"));
        when(rs.getBigDecimal("high")).thenReturn(new BigDecimal("106.00000000"));
        when(rs.getBigDecimal("low")).thenReturn(new BigDecimal("99.00000000"));
        when(rs.getBigDecimal("close")).thenReturn(new BigDecimal("101.00000000"));
        when(rs.getBigDecimal("volume")).thenReturn(new BigDecimal("3.00000000"));

        Optional<OhlcvBar> existing = repo.insertIfAbsent(BAR);

        assertTrue(existing.isPresent());
        assertEquals(0, new BigDecimal("106").compareTo(existing.get().high()));
        assertFalse(existing.get().samePayload(BAR));
    }

    @Test
    void insertIfAbsent_translatesCheckViolation() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(startsWith("INSERT"))).thenReturn(insertPs);
        when(insertPs.executeUpdate()).thenThrow(new SQLException("new row violates check constraint", "23514"));

        assertThrows(InvalidBarException.class, () -> repo.insertIfAbsent(BAR));
    }

    @Test
    void insertIfAbsent_translatesConnectionFailure() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

        StorageUnavailableException e = assertThrows(StorageUnavailableException.class, () -> repo.insertIfAbsent(BAR));
        assertTrue(e.isRetryable());
    }

    @Test
    void ensurePartition_createsQuotedTableWithChecks() throws SQLException {
        Statement st = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.createStatement()).thenReturn(st);

        repo.ensurePartition(PartitionKey.of(MARKET, Interval.FIVE_MINUTES));

        verify(st).execute(contains("\"PriceData_Bitfinex_USD_BTC_5mins\""));
        verify(st).execute(contains("CHECK (volume > 0)"));
        verify(st).execute(contains("% 300 = 0"));
    }

    @Test
    void discoverPartitions_parsesTableNames() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString())).thenReturn(selectPs);
        when(selectPs.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true, true, true, false);
        when(rs.getString(1)).thenReturn(
            "PriceData_Bitfinex_USD_BTC_1mins",
            "PriceData_Bitfinex_USD_BTC_tick",
            "PriceData_Bitflyer_JPY_BTC_60mins");

        Set<PartitionKey> partitions = repo.discoverPartitions();

        assertEquals(Set.of(
            PartitionKey.of(MARKET, Interval.ONE_MINUTE),
            PartitionKey.of(Market.of("JPY", "BTC", "Bitflyer"), Interval.ONE_HOUR)), partitions);
    }

    @Test
    void findRange_usesKeysetCursor() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(contains("\"timestamp\" > ?"))).thenReturn(selectPs);
        when(selectPs.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        List<OhlcvBar> page = repo.findRange(PartitionKey.of(MARKET, Interval.ONE_MINUTE),
            T0, T0.plusSeconds(3600), T0.plusSeconds(600), 100);

        assertTrue(page.isEmpty());
        verify(selectPs).setTimestamp(3, Timestamp.from(T0.plusSeconds(600)));
        verify(selectPs).setInt(4, 100);
    }

    @Test
    void deleteTicksOlderThan_returnsDeletedCount() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(startsWith("DELETE FROM \"PriceData_Bitfinex_USD_BTC_tick\""))).thenReturn(insertPs);
        when(insertPs.executeUpdate()).thenReturn(42);

        assertEquals(42, repo.deleteTicksOlderThan(MARKET, T0));
    }
}
