package com.chatbot.resilience.breaker;

import com.chatbot.resilience.model.CircuitBreakerState;

import java.time.Duration;

/**
 * Exception raised by a circuit breaker itself, as opposed to errors of the wrapped call.
 */
public class CircuitBreakerException extends RuntimeException {
    
    private final String code;
    private final String breakerName;
    
    public CircuitBreakerException(String code, String breakerName, String message) {
        super(message);
        this.code = code;
        this.breakerName = breakerName;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getBreakerName() {
        return breakerName;
    }
    
    /**
     * Thrown when a call is rejected because the breaker is open.
     */
    public static class CircuitOpenException extends CircuitBreakerException {
        public static final String CODE = "CIRCUIT_OPEN";
        
        private final CircuitBreakerState state;
        
        public CircuitOpenException(String breakerName, CircuitBreakerState state) {
            super(CODE, breakerName, String.format("Circuit breaker is OPEN: %s", breakerName));
            this.state = state;
        }
        
        public CircuitBreakerState getState() {
            return state;
        }
    }
    
    /**
     * Thrown when a call does not complete within the breaker's timeout.
     */
    public static class CallTimeoutException extends CircuitBreakerException {
        public static final String CODE = "CIRCUIT_TIMEOUT";
        
        private final Duration timeout;
        
        public CallTimeoutException(String breakerName, Duration timeout) {
            super(CODE, breakerName, String.format("Circuit breaker timeout: %s (%dms)", breakerName, timeout.toMillis()));
            this.timeout = timeout;
        }
        
        public Duration getTimeout() {
            return timeout;
        }
    }
}
