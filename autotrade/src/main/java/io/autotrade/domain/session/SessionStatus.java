package io.autotrade.domain.session;

/**
 * SmallSession lifecycle. CLOSED is terminal.
 */
public enum SessionStatus {
    OPEN,
    CLOSED
}
