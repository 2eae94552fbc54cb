package com.chatbot.resilience.breaker;

/**
 * Raised by policy fallbacks when a dependency is down. Carries a stable code for
 * callers and a message that is safe to show to users.
 */
public class ServiceUnavailableException extends RuntimeException {
    
    private final String code;
    
    public ServiceUnavailableException(String code, String message) {
        super(message);
        this.code = code;
    }
    
    public ServiceUnavailableException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getUserMessage() {
        return getMessage();
    }
}
