package com.lms.fallback.model;

import java.time.Instant;

/**
 * Callback interface for circuit breaker state transitions.
 */
@FunctionalInterface
public interface CircuitStateListener {
    /**
     * Called after the circuit breaker changed state.
     * 
     * @param from the state before the transition
     * @param to the state after the transition
     * @param at the instant of the transition
     */
    void onStateTransition(CircuitBreakerState from, CircuitBreakerState to, Instant at);
}
