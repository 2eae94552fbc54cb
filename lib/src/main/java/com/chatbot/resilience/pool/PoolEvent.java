package com.chatbot.resilience.pool;

/**
 * Connection pool events for monitoring and alerting.
 */
public enum PoolEvent {
    
    /**
     * Pool utilization is above the configured threshold.
     */
    HIGH_UTILIZATION_WARNING,
    
    /**
     * Threads are waiting for a connection. This may indicate a connection leak
     * or an undersized pool.
     */
    POOL_EXHAUSTED,
    
    /**
     * Startup probe of the pool succeeded.
     */
    HEALTH_CHECK_PASSED,
    
    /**
     * Startup probe of the pool failed.
     */
    HEALTH_CHECK_FAILED,
    
    /**
     * The pool was closed.
     */
    POOL_CLOSED
}
