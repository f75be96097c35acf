package io.autotrade.service.session;

import io.autotrade.domain.common.NotFoundException;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.session.SessionId;
import io.autotrade.domain.session.SmallSession;
import io.autotrade.util.Decimals;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Basket of independent SmallSessions on one market.
 *
 * Scaling in or out is expressed as more sessions, never as a change to an
 * existing one. Session state is always read from the tracker, so the
 * basket reflects closes made through any path.
 */
public final class BigSession {

    private final Market market;
    private final SessionTracker tracker;
    private final Set<SessionId> sessionIds = new LinkedHashSet<>();

    public BigSession(Market market, SessionTracker tracker) {
        this.market = market;
        this.tracker = tracker;
    }

    public Market getMarket() {
        return market;
    }

    /**
     * @throws NotFoundException        if the tracker does not know the session
     * @throws IllegalArgumentException if the session trades a different market
     */
    public synchronized void addSession(SmallSession session) {
        SmallSession tracked = tracker.get(session.id());
        if (!tracked.market().equals(market)) {
            throw new IllegalArgumentException("Session " + session.id() + " trades " + tracked.market()
                + ", basket is " + market);
        }
        sessionIds.add(session.id());
    }

    /**
     * Open a new session through the tracker and add it to the basket.
     */
    public SmallSession open(BigDecimal price, BigDecimal amount) {
        SmallSession session = tracker.open(market, price, amount);
        addSession(session);
        return session;
    }

    public synchronized List<SmallSession> sessions() {
        return sessionIds.stream().map(tracker::get).toList();
    }

    public List<SmallSession> openSessions() {
        return sessions().stream().filter(SmallSession::isOpen).toList();
    }

    public List<SmallSession> closedSessions() {
        return sessions().stream().filter(SmallSession::isClosed).toList();
    }

    /**
     * Realized P/L of closed sessions.
     */
    public BigDecimal realizedPnl() {
        return closedSessions().stream()
            .map(SmallSession::realizedPnl)
            .reduce(Decimals.fixed(BigDecimal.ZERO), BigDecimal::add);
    }

    /**
     * Realized P/L of closed sessions plus unrealized P/L of open ones at {@code markPrice}.
     */
    public BigDecimal aggregatePnL(BigDecimal markPrice) {
        return sessions().stream()
            .map(s -> s.pnl(markPrice))
            .reduce(Decimals.fixed(BigDecimal.ZERO), BigDecimal::add);
    }

    public synchronized int size() {
        return sessionIds.size();
    }
}
