package com.chatbot.resilience.model;

/**
 * Coarse health classification reported by breakers and the registry.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;
    
    /**
     * Maps a breaker state onto its health classification.
     *
     * @param state the breaker state
     * @return HEALTHY for CLOSED, DEGRADED for HALF_OPEN, UNHEALTHY for OPEN
     */
    public static HealthStatus fromState(CircuitBreakerState state) {
        return switch (state) {
            case CLOSED -> HEALTHY;
            case HALF_OPEN -> DEGRADED;
            case OPEN -> UNHEALTHY;
        };
    }
}
