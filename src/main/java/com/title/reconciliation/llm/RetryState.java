package com.title.reconciliation.llm;

/**
 * States of a single resolution's retry loop.
 */
public enum RetryState {
    /**
     * A provider call is due or in flight.
     */
    ATTEMPT,

    /**
     * The last call failed transiently and the backoff is running.
     */
    WAIT,

    /**
     * Backoff elapsed; the next call is about to be issued.
     */
    RETRY,

    /**
     * A call returned an answer. Terminal.
     */
    SUCCEEDED,

    /**
     * No further attempt will be made. Terminal.
     */
    GIVE_UP;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == GIVE_UP;
    }
}
