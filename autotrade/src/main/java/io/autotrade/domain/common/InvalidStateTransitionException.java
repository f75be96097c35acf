package io.autotrade.domain.common;

/**
 * Raised on a session lifecycle violation: closing a closed session or
 * opening a session id that is already in use.
 */
public class InvalidStateTransitionException extends PriceBaseException {

    private final String sessionId;
    private final String from;
    private final String attempted;

    public InvalidStateTransitionException(String sessionId, String from, String attempted) {
        super(String.format("Session %s cannot %s from state %s", sessionId, attempted, from));
        this.sessionId = sessionId;
        this.from = from;
        this.attempted = attempted;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFrom() {
        return from;
    }

    public String getAttempted() {
        return attempted;
    }
}
