package com.title.reconciliation.llm;

/**
 * Runtime exception thrown by a provider for failures worth retrying.
 */
public class TransientProviderException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        SERVER_ERROR,
        RATE_LIMITED,
        UNAVAILABLE
    }

    private final Reason reason;

    public TransientProviderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransientProviderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
