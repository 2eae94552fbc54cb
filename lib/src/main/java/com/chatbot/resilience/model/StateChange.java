package com.chatbot.resilience.model;

import java.time.Instant;

/**
 * One entry in a breaker's state-change history.
 */
public record StateChange(CircuitBreakerState from, CircuitBreakerState to, Instant timestamp) {
    
    @Override
    public String toString() {
        return String.format("%s -> %s at %s", from, to, timestamp);
    }
}
