package io.autotrade.domain.session;

import io.autotrade.domain.common.InvalidStateTransitionException;
import io.autotrade.domain.market.Market;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SmallSessionTest {

    private static final Market MARKET = Market.of("USD", "BTC", "Bitfinex");
    private static final Instant OPENED = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant CLOSED = Instant.parse("2024-01-01T01:00:00Z");

    private SmallSession openSession() {
        return SmallSession.open(new SessionId("s-1"), MARKET, new BigDecimal("100"), new BigDecimal("2"), OPENED);
    }

    @Test
    void testCloseComputesRealizedPnl() {
        SmallSession closed = openSession().close(new BigDecimal("110"), CLOSED);

        assertTrue(closed.isClosed());
        assertEquals(0, new BigDecimal("200").compareTo(closed.cost()));
        assertEquals(0, new BigDecimal("220").compareTo(closed.proceeds()));
        assertEquals(0, new BigDecimal("20").compareTo(closed.realizedPnl()), "P/L = (110 - 100) * 2");
        assertEquals(CLOSED, closed.closedAt());
    }

    @Test
    void testLossIsNegative() {
        SmallSession closed = openSession().close(new BigDecimal("95.5"), CLOSED);
        assertEquals(0, new BigDecimal("-9").compareTo(closed.realizedPnl()));
    }

    @Test
    void testDoubleCloseFailsAndLeavesStateUnchanged() {
        SmallSession closed = openSession().close(new BigDecimal("110"), CLOSED);

        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
            () -> closed.close(new BigDecimal("120"), CLOSED.plusSeconds(60)));
        assertEquals("CLOSED", e.getFrom());
        assertEquals(0, new BigDecimal("110").compareTo(closed.closedPrice()), "Closed session must not change");
    }

    @Test
    void testOpenInstanceIsUntouchedByClose() {
        SmallSession open = openSession();
        open.close(new BigDecimal("110"), CLOSED);

        assertTrue(open.isOpen());
        assertNull(open.closedPrice());
        assertThrows(IllegalStateException.class, open::realizedPnl);
    }

    @Test
    void testUnrealizedPnl() {
        SmallSession open = openSession();
        assertEquals(0, new BigDecimal("-10").compareTo(open.unrealizedPnl(new BigDecimal("95"))));
        assertEquals(0, new BigDecimal("10").compareTo(open.pnl(new BigDecimal("105"))));
    }

    @Test
    void testRejectsNonPositiveAmountOrPrice() {
        SessionId id = new SessionId("s-2");
        assertThrows(IllegalArgumentException.class,
            () -> SmallSession.open(id, MARKET, new BigDecimal("100"), BigDecimal.ZERO, OPENED));
        assertThrows(IllegalArgumentException.class,
            () -> SmallSession.open(id, MARKET, new BigDecimal("-1"), BigDecimal.ONE, OPENED));
        assertThrows(IllegalArgumentException.class,
            () -> openSession().close(BigDecimal.ZERO, CLOSED));
    }
}
