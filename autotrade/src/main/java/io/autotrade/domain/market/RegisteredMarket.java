package io.autotrade.domain.market;

import java.time.Instant;

/**
 * Registry record: a market together with its id and retirement flag.
 * Markets are never deleted, retirement only clears {@code active}.
 */
public record RegisteredMarket(
    MarketId id,
    Market market,
    boolean active,
    Instant registeredAt
) {
    public RegisteredMarket withActive(boolean flag) {
        return new RegisteredMarket(id, market, flag, registeredAt);
    }
}
