package com.chatbot.resilience.pool;

/**
 * Functional interface for pool event listeners.
 */
@FunctionalInterface
public interface PoolEventListener {
    
    /**
     * Called when a pool event occurs.
     * 
     * @param poolName the pool where the event occurred, e.g. "primary" or "replica"
     * @param event the type of pool event
     * @param details human-readable details
     */
    void onPoolEvent(String poolName, PoolEvent event, String details);
}
