package com.chatbot.resilience.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Health view of a single breaker.
 */
public record CircuitHealth(
        String name,
        HealthStatus status,
        CircuitBreakerState state,
        int failureCount,
        Instant lastFailure,
        Instant nextAttempt) {
    
    public Optional<Instant> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }
    
    public Optional<Instant> getNextAttempt() {
        return Optional.ofNullable(nextAttempt);
    }
}
