package io.autotrade.service.backtest;

import io.autotrade.domain.data.Interval;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.session.SmallSession;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a naive backtest run.
 */
public record BacktestResult(
    Market market,
    Interval interval,
    List<BacktestStep> steps,
    List<SmallSession> sessions,
    BigDecimal startingCapital,
    BigDecimal finalBalance,
    BigDecimal realizedPnl
) {
    public long trades() {
        return sessions.stream().filter(SmallSession::isClosed).count();
    }

    public BigDecimal finalPnl() {
        return steps.isEmpty() ? BigDecimal.ZERO : steps.get(steps.size() - 1).cumulativePnl();
    }
}
