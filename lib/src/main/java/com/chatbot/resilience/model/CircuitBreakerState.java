package com.chatbot.resilience.model;

/**
 * Circuit breaker state for a single protected dependency.
 */
public enum CircuitBreakerState {
    
    /**
     * Circuit breaker is closed - calls flow through to the dependency.
     */
    CLOSED,
    
    /**
     * Circuit breaker is open - calls fail fast until the reset deadline passes.
     */
    OPEN,
    
    /**
     * Circuit breaker is half-open - calls are let through to probe recovery.
     */
    HALF_OPEN
}
