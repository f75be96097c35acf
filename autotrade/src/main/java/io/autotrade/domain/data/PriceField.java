package io.autotrade.domain.data;

import java.math.BigDecimal;

/**
 * Bar field an indicator reads.
 */
public enum PriceField {
    OPEN,
    HIGH,
    LOW,
    CLOSE,
    VOLUME;

    public BigDecimal of(OhlcvBar bar) {
        return switch (this) {
            case OPEN -> bar.open();
            case HIGH -> bar.high();
            case LOW -> bar.low();
            case CLOSE -> bar.close();
            case VOLUME -> bar.volume();
        };
    }
}
