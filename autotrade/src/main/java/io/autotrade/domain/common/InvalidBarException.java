package io.autotrade.domain.common;

/**
 * Raised when a bar or tick violates a schema constraint
 * (price ordering, positive volume, alignment, future timestamp, precision).
 */
public class InvalidBarException extends PriceBaseException {

    public InvalidBarException(String message) {
        super(message);
    }

    public InvalidBarException(String message, Throwable cause) {
        super(message, cause);
    }
}
