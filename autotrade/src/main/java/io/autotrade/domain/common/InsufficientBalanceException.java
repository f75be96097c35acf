package io.autotrade.domain.common;

import java.math.BigDecimal;

/**
 * Raised when an account cannot cover the cost of opening a session.
 */
public class InsufficientBalanceException extends PriceBaseException {

    private final String exchange;
    private final String currency;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBalanceException(String exchange, String currency, BigDecimal required, BigDecimal available) {
        super(String.format("[%s] Tried to remove %s %s while having %s %s",
            exchange, required.toPlainString(), currency, available.toPlainString(), currency));
        this.exchange = exchange;
        this.currency = currency;
        this.required = required;
        this.available = available;
    }

    public String getExchange() {
        return exchange;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
