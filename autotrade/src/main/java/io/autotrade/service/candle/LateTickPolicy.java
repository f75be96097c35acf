package io.autotrade.service.candle;

/**
 * What to do with a tick whose bucket has already been finalized and stored.
 */
public enum LateTickPolicy {
    /** Raise a ConflictException to the producer. */
    REJECT,
    /** Log a warning and discard the tick. */
    DROP
}
