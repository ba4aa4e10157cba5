package com.title.reconciliation.job;

/**
 * Thrown when a job or its configuration is rejected before any record is dispatched.
 */
public class SetupException extends RuntimeException {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
