package com.chatbot.resilience.degradation;

import java.util.Optional;
import java.util.function.Function;

/**
 * Options for {@link DegradationCoordinator#execute}.
 * A null static fallback value is distinct from having none.
 */
public class ExecuteOptions<T> {
    
    
    private final Function<Throwable, ? extends T> fallback;
    private final T fallbackValue;
    private final boolean hasFallbackValue;
    private final String cacheKey;
    
    private ExecuteOptions(Builder<T> builder) {
        this.fallback = builder.fallback;
        this.fallbackValue = builder.fallbackValue;
        this.hasFallbackValue = builder.hasFallbackValue;
        this.cacheKey = builder.cacheKey;
    }
    
    public Optional<Function<Throwable, ? extends T>> getFallback() {
        return Optional.ofNullable(fallback);
    }
    
    public T getFallbackValue() {
        return fallbackValue;
    }
    
    public boolean hasFallbackValue() {
        return hasFallbackValue;
    }
    
    public Optional<String> getCacheKey() {
        return Optional.ofNullable(cacheKey);
    }
    
    public static <T> ExecuteOptions<T> none() {
        return new Builder<T>().build();
    }
    
    public static <T> Builder<T> builder() {
        return new Builder<>();
    }
    
    public static class Builder<T> {
        private Function<Throwable, ? extends T> fallback;
        private T fallbackValue;
        private boolean hasFallbackValue;
        private String cacheKey;
        
        /**
         * Fallback tried first when the call fails. It receives null when the call was
         * skipped because the service is unavailable.
         */
        public Builder<T> fallback(Function<Throwable, ? extends T> fallback) {
            this.fallback = fallback;
            return this;
        }
        
        /**
         * Static value returned as the last resort before a failure result. May be null.
         */
        public Builder<T> fallbackValue(T fallbackValue) {
            this.fallbackValue = fallbackValue;
            this.hasFallbackValue = true;
            return this;
        }
        
        /**
         * Key under which successful results are cached for stale reads.
         */
        public Builder<T> cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }
        
        public ExecuteOptions<T> build() {
            return new ExecuteOptions<>(this);
        }
    }
}
