package io.autotrade.domain.data;

import io.autotrade.domain.market.Market;
import io.autotrade.util.Decimals;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One executed trade. Append-only, never mutated.
 */
public record PriceTick(
    Market market,
    Instant timestamp,
    BigDecimal price,
    BigDecimal volume
) {
    public PriceTick {
        if (market == null || timestamp == null) {
            throw new IllegalArgumentException("market and timestamp cannot be null");
        }
        price = Decimals.normalize(price);
        volume = Decimals.normalize(volume);
    }

    public static PriceTick of(Market market, Instant timestamp, String price, String volume) {
        return new PriceTick(market, timestamp, new BigDecimal(price), new BigDecimal(volume));
    }
}
