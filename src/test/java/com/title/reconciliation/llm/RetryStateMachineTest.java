package com.title.reconciliation.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryStateMachineTest {

    private RetryStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new RetryStateMachine(RetryPolicy.defaults());
    }

    @Test
    @DisplayName("Starts in the first attempt")
    void testInitialState() {
        assertEquals(RetryState.ATTEMPT, machine.state());
        assertEquals(1, machine.attempt());
    }

    @Test
    @DisplayName("Success on first attempt is terminal")
    void testImmediateSuccess() {
        assertEquals(RetryState.SUCCEEDED, machine.onSuccess());
        assertTrue(machine.state().isTerminal());
        assertThrows(IllegalStateException.class, machine::onTransientFailure);
    }

    @Test
    @DisplayName("Failures wait, retry and finally give up")
    void testGiveUpAfterMaxAttempts() {
        assertEquals(RetryState.WAIT, machine.onTransientFailure());
        assertEquals(Duration.ofSeconds(4), machine.backoff());
        assertEquals(RetryState.ATTEMPT, machine.onWaitElapsed());
        assertEquals(2, machine.attempt());

        assertEquals(RetryState.WAIT, machine.onTransientFailure());
        assertEquals(Duration.ofSeconds(8), machine.backoff());
        machine.onWaitElapsed();

        assertEquals(RetryState.GIVE_UP, machine.onTransientFailure());
        assertEquals(3, machine.attempt());
        assertTrue(machine.state().isTerminal());
    }

    @Test
    @DisplayName("Success after a retry")
    void testSuccessAfterRetry() {
        machine.onTransientFailure();
        machine.onWaitElapsed();

        assertEquals(RetryState.SUCCEEDED, machine.onSuccess());
        assertEquals(2, machine.attempt());
    }

    @Test
    @DisplayName("Interruption gives up")
    void testInterrupted() {
        machine.onTransientFailure();

        assertEquals(RetryState.GIVE_UP, machine.onInterrupted());
        assertThrows(IllegalStateException.class, machine::onInterrupted);
    }

    @Test
    @DisplayName("Cancellation gives up from any open state")
    void testCancelled() {
        machine.onTransientFailure();
        machine.onWaitElapsed();

        assertEquals(RetryState.GIVE_UP, machine.onCancelled());
        assertEquals(2, machine.attempt());
        assertThrows(IllegalStateException.class, machine::onCancelled);
    }

    @Test
    @DisplayName("Illegal transitions are rejected")
    void testIllegalTransitions() {
        assertThrows(IllegalStateException.class, machine::backoff);
        assertThrows(IllegalStateException.class, machine::onWaitElapsed);

        machine.onTransientFailure();
        assertThrows(IllegalStateException.class, machine::onSuccess);
    }

    @Test
    @DisplayName("Single-attempt policy gives up on first failure")
    void testNoRetry() {
        RetryStateMachine single = new RetryStateMachine(RetryPolicy.noRetry());

        assertEquals(RetryState.GIVE_UP, single.onTransientFailure());
    }
}
