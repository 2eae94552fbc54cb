package com.chatbot.resilience.breaker;

import com.chatbot.resilience.model.CircuitBreakerState;

/**
 * Observer of breaker transitions and rejections.
 * Callbacks run synchronously on the thread that caused them, once per event.
 */
public interface CircuitBreakerListener {
    
    /**
     * Called after the breaker changed state.
     * 
     * @param event the transition
     */
    void onStateChange(CircuitStateChangeEvent event);
    
    /**
     * Called when a call was rejected without invoking the dependency.
     * 
     * @param name the breaker name
     * @param state the state the breaker was in
     */
    default void onCallRejected(String name, CircuitBreakerState state) {
    }
}
