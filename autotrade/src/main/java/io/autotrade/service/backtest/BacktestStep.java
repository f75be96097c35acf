package io.autotrade.service.backtest;

import io.autotrade.domain.signal.RollingAverage;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One replayed period: the signal seen, the action taken and the running P/L.
 */
public record BacktestStep(
    Instant timestamp,
    RollingAverage signal,
    boolean bought,
    boolean sold,
    BigDecimal cumulativePnl
) {
}
