package com.title.reconciliation.llm;

import java.time.Duration;

/**
 * Tracks one resolution through {@code ATTEMPT -> WAIT -> RETRY -> ATTEMPT ... -> SUCCEEDED | GIVE_UP}.
 * Interruption and cancellation move any non-terminal state to GIVE_UP.
 * Not thread-safe; each resolution owns its own instance.
 */
public class RetryStateMachine {

    private final RetryPolicy policy;
    private RetryState state = RetryState.ATTEMPT;
    private int attempt = 1;

    public RetryStateMachine(RetryPolicy policy) {
        this.policy = policy;
    }

    public RetryState state() {
        return state;
    }

    /**
     * The 1-based number of the current (or last) attempt.
     */
    public int attempt() {
        return attempt;
    }

    /**
     * The attempt returned an answer.
     */
    public RetryState onSuccess() {
        require(RetryState.ATTEMPT, "onSuccess");
        state = RetryState.SUCCEEDED;
        return state;
    }

    /**
     * The attempt failed transiently. Moves to WAIT, or GIVE_UP when no attempts remain.
     */
    public RetryState onTransientFailure() {
        require(RetryState.ATTEMPT, "onTransientFailure");
        state = attempt >= policy.maxAttempts() ? RetryState.GIVE_UP : RetryState.WAIT;
        return state;
    }

    /**
     * How long to wait in the current WAIT state.
     */
    public Duration backoff() {
        require(RetryState.WAIT, "backoff");
        return policy.backoffFor(attempt);
    }

    /**
     * The backoff elapsed. Passes through RETRY and arms the next attempt.
     */
    public RetryState onWaitElapsed() {
        require(RetryState.WAIT, "onWaitElapsed");
        state = RetryState.RETRY;
        attempt++;
        state = RetryState.ATTEMPT;
        return state;
    }

    /**
     * Waiting was interrupted; abandon the remaining attempts.
     */
    public RetryState onInterrupted() {
        if (state.isTerminal()) {
            throw new IllegalStateException("onInterrupted not allowed in state " + state);
        }
        state = RetryState.GIVE_UP;
        return state;
    }

    /**
     * The job was cancelled; no further attempt is issued.
     */
    public RetryState onCancelled() {
        if (state.isTerminal()) {
            throw new IllegalStateException("onCancelled not allowed in state " + state);
        }
        state = RetryState.GIVE_UP;
        return state;
    }

    private void require(RetryState expected, String transition) {
        if (state != expected) {
            throw new IllegalStateException(transition + " not allowed in state " + state);
        }
    }
}
