package com.chatbot.resilience.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Snapshot of a service tracked by the degradation coordinator.
 *
 * @param name the service name
 * @param state the current state
 * @param critical whether the service being unavailable makes the system CRITICAL
 * @param lastHealthy when the service was last marked healthy
 * @param degradedSince when the service first left HEALTHY, or null while healthy
 * @param failureCount number of marks since the service was last healthy
 */
public record ServiceInfo(
        String name,
        ServiceState state,
        boolean critical,
        Instant lastHealthy,
        Instant degradedSince,
        int failureCount) {
    
    public Optional<Instant> getDegradedSince() {
        return Optional.ofNullable(degradedSince);
    }
    
    public boolean isHealthy() {
        return state == ServiceState.HEALTHY;
    }
}
