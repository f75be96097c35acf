package io.autotrade.service.backtest;

import io.autotrade.domain.common.InsufficientBalanceException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.PriceField;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.session.SessionId;
import io.autotrade.domain.session.SmallSession;
import io.autotrade.domain.signal.RollingAverage;
import io.autotrade.service.session.BigSession;
import io.autotrade.service.session.SessionTracker;
import io.autotrade.service.signal.RollingAverageCalculator;
import io.autotrade.util.Decimals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Naive Backtester - mean-reversion replay over stored bars.
 *
 * Rules, evaluated once per period:
 * - Flat and the rolling average is above the current price: buy with the
 *   whole base balance
 * - Holding and the rolling average is below the current price: sell
 * - Insufficient history or a missing current bar: do nothing
 *
 * Each run uses its own SessionTracker and Account, so runs never share state.
 */
public final class NaiveBacktester {
    private static final Logger log = LoggerFactory.getLogger(NaiveBacktester.class);

    private final RollingAverageCalculator indicator;
    private final Clock clock;

    public NaiveBacktester(RollingAverageCalculator indicator, Clock clock) {
        this.indicator = indicator;
        this.clock = clock;
    }

    /**
     * Replay every period start in [from, to).
     *
     * @param startingCapital base-currency balance funding the run
     */
    public BacktestResult run(Market market, Interval interval, Instant from, Instant to,
                              PriceField field, int windowSize, BigDecimal startingCapital) {
        if (!Decimals.isPositive(startingCapital)) {
            throw new IllegalArgumentException("startingCapital must be > 0: " + startingCapital);
        }

        SessionTracker tracker = new SessionTracker(clock);
        tracker.account(market).deposit(market.base(), startingCapital);
        BigSession basket = new BigSession(market, tracker);

        List<BacktestStep> steps = new ArrayList<>();
        SmallSession holding = null;
        BigDecimal lastPrice = null;

        Instant t = interval.isAligned(from) ? from : interval.floor(from).plusSeconds(interval.seconds());
        log.info("Backtesting {} {} from {} to {} (window {} on {})", market, interval, t, to, windowSize, field);

        while (t.isBefore(to)) {
            RollingAverage signal = indicator.rollingAverage(market, interval, t, field, windowSize);
            boolean bought = false;
            boolean sold = false;

            if (signal.hasCurrentPrice()) {
                BigDecimal price = signal.currentPrice();
                lastPrice = price;

                if (holding == null && signal.isAboveCurrent()) {
                    holding = buy(tracker, basket, market, price, t);
                    bought = holding != null;
                } else if (holding != null && signal.isBelowCurrent()) {
                    tracker.close(holding.id(), price, t);
                    holding = null;
                    sold = true;
                }
            }

            BigDecimal pnl = lastPrice == null ? Decimals.fixed(BigDecimal.ZERO) : basket.aggregatePnL(lastPrice);
            steps.add(new BacktestStep(t, signal, bought, sold, pnl));
            t = t.plusSeconds(interval.seconds());
        }

        BigDecimal finalBalance = tracker.account(market).balance(market.base());
        BacktestResult result = new BacktestResult(market, interval, steps, basket.sessions(),
            Decimals.fixed(startingCapital), finalBalance, basket.realizedPnl());

        log.info("Backtest {} {}: {} periods, {} round trips, realized P/L {}",
            market, interval, steps.size(), result.trades(), result.realizedPnl().toPlainString());
        return result;
    }

    private SmallSession buy(SessionTracker tracker, BigSession basket, Market market, BigDecimal price, Instant at) {
        BigDecimal balance = tracker.account(market).balance(market.base());
        BigDecimal amount = balance.divide(price, Decimals.SCALE, RoundingMode.DOWN);
        if (amount.signum() <= 0) {
            log.debug("Balance {} too small to buy at {}", balance.toPlainString(), price.toPlainString());
            return null;
        }
        try {
            SmallSession session = tracker.open(SessionId.random(), market, price, amount, at);
            basket.addSession(session);
            return session;
        } catch (InsufficientBalanceException e) {
            log.debug("Skipped buy at {}: {}", at, e.getMessage());
            return null;
        }
    }
}
