package com.chatbot.resilience.breaker;

/**
 * An HTTP error response from a remote API. Clients wrap non-2xx responses in this
 * so breaker policies can inspect the status code.
 */
public class HttpStatusException extends RuntimeException {
    
    private final int statusCode;
    
    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
    
    public HttpStatusException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
}
