package com.chatbot.resilience.model;

/**
 * Health state of a service tracked by the degradation coordinator.
 */
public enum ServiceState {
    HEALTHY,
    DEGRADED,
    UNAVAILABLE
}
