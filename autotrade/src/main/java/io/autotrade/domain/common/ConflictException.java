package io.autotrade.domain.common;

import io.autotrade.domain.data.OhlcvBar;

/**
 * Raised when an incoming bar collides with a stored bar of the same
 * (market, interval, periodStart) but carries a different payload.
 */
public class ConflictException extends PriceBaseException {

    private final OhlcvBar existing;
    private final OhlcvBar incoming;

    public ConflictException(OhlcvBar existing, OhlcvBar incoming) {
        super(String.format("Conflicting bar for %s @ %s: stored=%s incoming=%s",
            existing.partition().tableName(), existing.periodStart(),
            existing.payloadString(), incoming.payloadString()));
        this.existing = existing;
        this.incoming = incoming;
    }

    public OhlcvBar getExisting() {
        return existing;
    }

    public OhlcvBar getIncoming() {
        return incoming;
    }
}
