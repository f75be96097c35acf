package io.autotrade.domain.session;

import io.autotrade.domain.common.InvalidStateTransitionException;
import io.autotrade.domain.market.Market;
import io.autotrade.util.Decimals;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One atomic hypothetical position: exactly one entry and at most one exit.
 * Cannot be topped up or partially closed. Closing returns a new, terminal
 * instance; the open instance is left untouched.
 */
public record SmallSession(
    SessionId id,
    Market market,
    BigDecimal startedPrice,
    BigDecimal amount,
    Instant openedAt,
    SessionStatus status,
    BigDecimal closedPrice,
    Instant closedAt
) {
    public SmallSession {
        if (id == null || market == null || openedAt == null || status == null) {
            throw new IllegalArgumentException("id, market, openedAt and status cannot be null");
        }
        if (!Decimals.isPositive(startedPrice)) {
            throw new IllegalArgumentException("startedPrice must be > 0: " + startedPrice);
        }
        if (!Decimals.isPositive(amount)) {
            throw new IllegalArgumentException("amount must be > 0: " + amount);
        }
        if (status == SessionStatus.CLOSED && (closedPrice == null || closedAt == null)) {
            throw new IllegalArgumentException("closed session needs closedPrice and closedAt");
        }
    }

    public static SmallSession open(SessionId id, Market market, BigDecimal price, BigDecimal amount, Instant openedAt) {
        return new SmallSession(id, market, price, amount, openedAt, SessionStatus.OPEN, null, null);
    }

    public boolean isOpen() {
        return status == SessionStatus.OPEN;
    }

    public boolean isClosed() {
        return status == SessionStatus.CLOSED;
    }

    /**
     * Transition OPEN -> CLOSED.
     *
     * @throws InvalidStateTransitionException if already closed
     */
    public SmallSession close(BigDecimal price, Instant at) {
        if (status != SessionStatus.OPEN) {
            throw new InvalidStateTransitionException(id.value(), status.name(), "close");
        }
        if (!Decimals.isPositive(price)) {
            throw new IllegalArgumentException("close price must be > 0: " + price);
        }
        return new SmallSession(id, market, startedPrice, amount, openedAt, SessionStatus.CLOSED, price, at);
    }

    /**
     * Amount debited on open: startedPrice * amount.
     */
    public BigDecimal cost() {
        return Decimals.fixed(startedPrice.multiply(amount));
    }

    /**
     * Amount credited on close: closedPrice * amount.
     */
    public BigDecimal proceeds() {
        requireClosed();
        return Decimals.fixed(closedPrice.multiply(amount));
    }

    /**
     * (closedPrice - startedPrice) * amount, taken as proceeds - cost so that it
     * always equals the net change of the account balance after rounding.
     */
    public BigDecimal realizedPnl() {
        return proceeds().subtract(cost());
    }

    /**
     * (markPrice - startedPrice) * amount, for open sessions. Rounded the same
     * way as realizedPnl: the mark value and the cost are each fixed to 8 places.
     */
    public BigDecimal unrealizedPnl(BigDecimal markPrice) {
        return Decimals.fixed(markPrice.multiply(amount)).subtract(cost());
    }

    /**
     * Realized P/L when closed, unrealized at the mark otherwise.
     */
    public BigDecimal pnl(BigDecimal markPrice) {
        return isClosed() ? realizedPnl() : unrealizedPnl(markPrice);
    }

    private void requireClosed() {
        if (status != SessionStatus.CLOSED) {
            throw new IllegalStateException("Session " + id + " is still open");
        }
    }
}
