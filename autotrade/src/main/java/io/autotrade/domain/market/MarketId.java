package io.autotrade.domain.market;

/**
 * Stable identifier handed out by the market registry.
 */
public record MarketId(long value) {
    public MarketId {
        if (value <= 0) {
            throw new IllegalArgumentException("MarketId must be positive: " + value);
        }
    }

    @Override
    public String toString() {
        return "M" + value;
    }
}
