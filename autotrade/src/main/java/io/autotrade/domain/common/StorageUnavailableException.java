package io.autotrade.domain.common;

/**
 * Transient storage failure (connection loss, timeout, pool exhaustion).
 * Callers may retry with backoff; the core never retries on its own.
 */
public class StorageUnavailableException extends PriceBaseException {

    private final String operation;

    public StorageUnavailableException(String operation, Throwable cause) {
        super(String.format("Storage unavailable during %s: %s", operation,
            cause != null ? cause.getMessage() : "unknown"), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
