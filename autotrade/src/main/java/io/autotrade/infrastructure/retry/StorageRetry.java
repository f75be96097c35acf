package io.autotrade.infrastructure.retry;

import io.autotrade.domain.common.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Caller-side retry for storage operations.
 *
 * Only {@link StorageUnavailableException} is retried. Every other error
 * surfaces on the first attempt. When the policy is exhausted the last
 * storage error is rethrown.
 */
public final class StorageRetry {
    private static final Logger log = LoggerFactory.getLogger(StorageRetry.class);

    /**
     * Blocking wait between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final Supplier<RetryPolicy> policyFactory;
    private final Sleeper sleeper;

    public StorageRetry(Supplier<RetryPolicy> policyFactory, Sleeper sleeper) {
        this.policyFactory = policyFactory;
        this.sleeper = sleeper;
    }

    public StorageRetry(Supplier<RetryPolicy> policyFactory) {
        this(policyFactory, delay -> Thread.sleep(delay.toMillis()));
    }

    public <T> T call(String operation, Supplier<T> work) {
        RetryPolicy policy = policyFactory.get();
        while (true) {
            try {
                T result = work.get();
                policy.recordSuccess();
                return result;
            } catch (StorageUnavailableException e) {
                Duration delay = policy.getNextDelay();
                policy.recordFailure();
                if (!policy.shouldRetry()) {
                    log.error("Giving up on {} after {} attempts: {}", operation, policy.getAttemptCount(), e.getMessage());
                    throw e;
                }
                log.warn("Retrying {} in {} ms (attempt {}/{}): {}",
                    operation, delay.toMillis(), policy.getAttemptCount(), policy.getMaxAttempts(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    public void run(String operation, Runnable work) {
        call(operation, () -> {
            work.run();
            return null;
        });
    }
}
