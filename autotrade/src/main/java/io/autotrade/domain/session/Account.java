package io.autotrade.domain.session;

import io.autotrade.domain.common.InsufficientBalanceException;
import io.autotrade.util.Decimals;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-exchange currency balances funding hypothetical sessions.
 *
 * Every mutation runs under the account lock; {@link #transact(Supplier)}
 * lets a caller group several reads and writes into one serialized unit.
 * Balances never go negative.
 */
public final class Account {

    private final String exchange;
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public Account(String exchange) {
        if (exchange == null || exchange.isBlank()) {
            throw new IllegalArgumentException("exchange cannot be blank");
        }
        this.exchange = exchange;
    }

    public String getExchange() {
        return exchange;
    }

    /**
     * Run the given work as one serialized transaction on this account.
     */
    public <T> T transact(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal balance(String currency) {
        String key = currencyKey(currency);
        return transact(() -> balances.getOrDefault(key, Decimals.fixed(BigDecimal.ZERO)));
    }

    public void deposit(String currency, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("deposit must be >= 0: " + amount);
        }
        String key = currencyKey(currency);
        transact(() -> balances.merge(key, Decimals.fixed(amount), BigDecimal::add));
    }

    /**
     * Remove {@code amount} from the balance, leaving it unchanged on failure.
     *
     * @throws InsufficientBalanceException if the balance cannot cover it
     */
    public void withdraw(String currency, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("withdrawal must be >= 0: " + amount);
        }
        String key = currencyKey(currency);
        transact(() -> {
            BigDecimal current = balances.getOrDefault(key, Decimals.fixed(BigDecimal.ZERO));
            if (current.compareTo(amount) < 0) {
                throw new InsufficientBalanceException(exchange, key, amount, current);
            }
            balances.put(key, Decimals.fixed(current.subtract(amount)));
            return null;
        });
    }

    public Map<String, BigDecimal> snapshot() {
        return transact(() -> Map.copyOf(balances));
    }

    private static String currencyKey(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency cannot be blank");
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Account[" + exchange + " " + snapshot() + "]";
    }
}
