package com.chatbot.resilience.model;

/**
 * System-wide degradation level, derived from the states of all registered services.
 */
public enum DegradationLevel {
    
    /**
     * Every service is healthy.
     */
    NORMAL,
    
    /**
     * At least one service is degraded or unavailable, but no critical service is down.
     */
    DEGRADED,
    
    /**
     * A critical service is unavailable.
     */
    CRITICAL,
    
    /**
     * No service is healthy; requests cannot be served.
     */
    OFFLINE
}
