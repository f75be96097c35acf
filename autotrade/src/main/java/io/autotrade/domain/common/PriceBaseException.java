package io.autotrade.domain.common;

/**
 * Base of all errors raised by the market-data and session core.
 *
 * Only {@link StorageUnavailableException} is retryable; every other subtype
 * means the caller has to fix its input or pick a side in a conflict.
 */
public abstract class PriceBaseException extends RuntimeException {

    protected PriceBaseException(String message) {
        super(message);
    }

    protected PriceBaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the same call may succeed if repeated later.
     */
    public boolean isRetryable() {
        return false;
    }
}
