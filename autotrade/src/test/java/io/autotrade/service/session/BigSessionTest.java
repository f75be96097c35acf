package io.autotrade.service.session;

import io.autotrade.domain.common.NotFoundException;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.session.SessionId;
import io.autotrade.domain.session.SmallSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class BigSessionTest {

    private static final Market MARKET = Market.of("USD", "BTC", "Bitfinex");

    private SessionTracker tracker;
    private BigSession basket;

    @BeforeEach
    void setUp() {
        tracker = new SessionTracker(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
        tracker.account(MARKET).deposit("USD", new BigDecimal("10000"));
        basket = new BigSession(MARKET, tracker);
    }

    @Test
    void testAggregatePnlMixesRealizedAndUnrealized() {
        SmallSession a = basket.open(new BigDecimal("100"), new BigDecimal("2"));
        basket.open(new BigDecimal("120"), new BigDecimal("1"));
        tracker.close(a.id(), new BigDecimal("130"));

        // realized (130-100)*2 = 60, unrealized (110-120)*1 = -10
        assertEquals(0, new BigDecimal("50").compareTo(basket.aggregatePnL(new BigDecimal("110"))));
        assertEquals(0, new BigDecimal("60").compareTo(basket.realizedPnl()));
        assertEquals(1, basket.openSessions().size());
        assertEquals(1, basket.closedSessions().size());
    }

    @Test
    void testEmptyBasket() {
        assertEquals(0, basket.aggregatePnL(BigDecimal.TEN).signum());
        assertEquals(0, basket.size());
    }

    @Test
    void testSessionsMustShareTheMarket() {
        SmallSession foreign = tracker.open(Market.of("USD", "ETH", "Bitfinex"), BigDecimal.ONE, BigDecimal.ONE);

        assertThrows(IllegalArgumentException.class, () -> basket.addSession(foreign));
        assertEquals(0, basket.size());
    }

    @Test
    void testUntrackedSessionIsRejected() {
        basket.open(new BigDecimal("100"), BigDecimal.ONE);
        SmallSession untracked = SmallSession.open(new SessionId("never-opened"), MARKET,
            new BigDecimal("100"), BigDecimal.ONE, Instant.parse("2024-01-01T00:00:00Z"));

        assertThrows(NotFoundException.class, () -> basket.addSession(untracked));

        assertEquals(1, basket.size());
        assertEquals(1, basket.openSessions().size(), "Basket stays readable after the rejected add");
        assertEquals(0, new BigDecimal("10").compareTo(basket.aggregatePnL(new BigDecimal("110"))));
    }

    @Test
    void testAddingTwiceKeepsOneEntry() {
        SmallSession s = tracker.open(MARKET, BigDecimal.ONE, BigDecimal.ONE);
        basket.addSession(s);
        basket.addSession(s);

        assertEquals(1, basket.size());
        assertEquals(MARKET, basket.getMarket());
    }
}
