package com.chatbot.resilience.degradation;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a coordinated call. Callers branch on {@link #isSuccess()} instead of
 * handling exceptions.
 */
public class DegradedResult<T> {
    
    static final String DEFAULT_ERROR = "Service unavailable";
    
    private final boolean success;
    private final T data;
    private final boolean degraded;
    private final boolean stale;
    private final Duration cacheAge;
    private final String error;
    private final Throwable cause;
    
    private DegradedResult(boolean success, T data, boolean degraded, boolean stale,
                           Duration cacheAge, String error, Throwable cause) {
        this.success = success;
        this.data = data;
        this.degraded = degraded;
        this.stale = stale;
        this.cacheAge = cacheAge;
        this.error = error;
        this.cause = cause;
    }
    
    /**
     * The primary operation succeeded.
     */
    public static <T> DegradedResult<T> success(T data) {
        return new DegradedResult<>(true, data, false, false, null, null, null);
    }
    
    /**
     * A fallback supplied the data.
     */
    public static <T> DegradedResult<T> fallback(T data) {
        return new DegradedResult<>(true, data, true, false, null, null, null);
    }
    
    /**
     * The last cached value was served.
     */
    public static <T> DegradedResult<T> stale(T data, Duration cacheAge) {
        return new DegradedResult<>(true, data, true, true, cacheAge, null, null);
    }
    
    /**
     * Every fallback was exhausted.
     * 
     * @param cause the failure of the primary operation, or null if it was skipped
     */
    public static <T> DegradedResult<T> failure(Throwable cause) {
        String message = cause != null && cause.getMessage() != null ? cause.getMessage() : DEFAULT_ERROR;
        return new DegradedResult<>(false, null, true, false, null, message, cause);
    }
    
    public boolean isSuccess() {
        return success;
    }
    
    public T getData() {
        return data;
    }
    
    public boolean isDegraded() {
        return degraded;
    }
    
    public boolean isStale() {
        return stale;
    }
    
    public Optional<Duration> getCacheAge() {
        return Optional.ofNullable(cacheAge);
    }
    
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }
    
    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }
    
    @Override
    public String toString() {
        return String.format("DegradedResult{success=%s, degraded=%s, stale=%s, cacheAge=%s, error=%s}",
            success, degraded, stale, cacheAge, error);
    }
}
