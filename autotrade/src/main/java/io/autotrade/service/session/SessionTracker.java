package io.autotrade.service.session;

import io.autotrade.domain.common.InsufficientBalanceException;
import io.autotrade.domain.common.InvalidStateTransitionException;
import io.autotrade.domain.common.NotFoundException;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.session.Account;
import io.autotrade.domain.session.SessionId;
import io.autotrade.domain.session.SmallSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session Tracker - owns SmallSessions and the Accounts that fund them.
 *
 * Funding convention: a market's {@code base} is the currency sessions are
 * paid in. Opening debits {@code price * amount} of base from the account
 * of the market's exchange, closing credits {@code closePrice * amount}.
 *
 * Every open/close runs as one transaction on the account, so balance
 * changes and session state changes on the same account are serialized.
 */
public final class SessionTracker {
    private static final Logger log = LoggerFactory.getLogger(SessionTracker.class);

    private final Clock clock;
    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final Map<SessionId, SmallSession> sessions = new ConcurrentHashMap<>();

    public SessionTracker(Clock clock) {
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // Accounts
    // ═══════════════════════════════════════════════════════════════

    /**
     * Account of the given exchange, created empty on first use.
     */
    public Account account(String exchange) {
        return accounts.computeIfAbsent(exchange, Account::new);
    }

    public Account account(Market market) {
        return account(market.exchange());
    }

    public Collection<Account> accounts() {
        return List.copyOf(accounts.values());
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    public SmallSession open(Market market, BigDecimal price, BigDecimal amount) {
        return open(SessionId.random(), market, price, amount);
    }

    /**
     * Open a session and debit its cost from the account.
     *
     * @throws IllegalArgumentException        if price or amount is not positive
     * @throws InvalidStateTransitionException if a session with this id already exists
     * @throws InsufficientBalanceException    if the account cannot cover price * amount;
     *                                         the balance is left unchanged
     */
    public SmallSession open(SessionId id, Market market, BigDecimal price, BigDecimal amount) {
        return open(id, market, price, amount, clock.instant());
    }

    /**
     * Open at an explicit time, e.g. the bar being replayed in a backtest.
     */
    public SmallSession open(SessionId id, Market market, BigDecimal price, BigDecimal amount, Instant at) {
        SmallSession session = SmallSession.open(id, market, price, amount, at);
        Account account = account(market);

        return account.transact(() -> {
            SmallSession previous = sessions.putIfAbsent(id, session);
            if (previous != null) {
                throw new InvalidStateTransitionException(id.value(), previous.status().name(), "open");
            }
            try {
                account.withdraw(market.base(), session.cost());
            } catch (InsufficientBalanceException e) {
                sessions.remove(id, session);
                log.warn("Rejected session on {}: needs {} {}, has {}",
                    market, e.getRequired().toPlainString(), e.getCurrency(), e.getAvailable().toPlainString());
                throw e;
            }
            log.info("Opened session {} on {}: {} @ {}", id, market, amount.toPlainString(), price.toPlainString());
            return session;
        });
    }

    /**
     * Close an open session and credit its proceeds to the account.
     *
     * @throws NotFoundException               if no session has this id
     * @throws InvalidStateTransitionException if the session is already closed;
     *                                         nothing is changed
     */
    public SmallSession close(SessionId id, BigDecimal price) {
        return close(id, price, clock.instant());
    }

    public SmallSession close(SessionId id, BigDecimal price, Instant at) {
        SmallSession current = get(id);
        Account account = account(current.market());

        return account.transact(() -> {
            SmallSession latest = get(id);
            SmallSession closed = latest.close(price, at);
            account.deposit(closed.market().base(), closed.proceeds());
            sessions.put(id, closed);
            log.info("Closed session {} on {} @ {}: P/L {}",
                id, closed.market(), price.toPlainString(), closed.realizedPnl().toPlainString());
            return closed;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════

    public SmallSession get(SessionId id) {
        return find(id).orElseThrow(() -> new NotFoundException("Session", id.value()));
    }

    public Optional<SmallSession> find(SessionId id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public List<SmallSession> sessions(Market market) {
        return sessions.values().stream()
            .filter(s -> s.market().equals(market))
            .sorted(Comparator.comparing(SmallSession::openedAt))
            .toList();
    }

    public List<SmallSession> openSessions(Market market) {
        return sessions(market).stream().filter(SmallSession::isOpen).toList();
    }
}
