package com.chatbot.resilience.breaker;

import com.chatbot.resilience.model.CircuitBreakerState;

import java.time.Instant;

/**
 * A breaker state transition.
 */
public record CircuitStateChangeEvent(String name, CircuitBreakerState from, CircuitBreakerState to, Instant timestamp) {
    
    public boolean isRecovery() {
        return from == CircuitBreakerState.HALF_OPEN && to == CircuitBreakerState.CLOSED;
    }
}
