package com.chatbot.resilience.config;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Circuit breaker configuration for a single protected dependency.
 */
public class CircuitBreakerConfig {
    
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration timeout;
    private final Duration resetTimeout;
    private final Function<Throwable, ?> fallback;
    private final Predicate<Throwable> isFailure;
    private final boolean enabled;
    
    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.successThreshold = builder.successThreshold;
        this.timeout = builder.timeout;
        this.resetTimeout = builder.resetTimeout;
        this.fallback = builder.fallback;
        this.isFailure = builder.isFailure;
        this.enabled = builder.enabled;
    }
    
    /**
     * Consecutive failures in CLOSED state that trip the breaker.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }
    
    /**
     * Consecutive successes in HALF_OPEN state that close the breaker.
     */
    public int getSuccessThreshold() {
        return successThreshold;
    }
    
    /**
     * Maximum time a single call may take before it counts as a failure.
     */
    public Duration getTimeout() {
        return timeout;
    }
    
    /**
     * Time the breaker stays OPEN before the next call may probe the dependency.
     */
    public Duration getResetTimeout() {
        return resetTimeout;
    }
    
    /**
     * Fallback applied to failures and rejections, or null to rethrow.
     */
    public Function<Throwable, ?> getFallback() {
        return fallback;
    }
    
    public boolean hasFallback() {
        return fallback != null;
    }
    
    public Predicate<Throwable> getIsFailure() {
        return isFailure;
    }
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public Builder toBuilder() {
        return new Builder()
            .failureThreshold(failureThreshold)
            .successThreshold(successThreshold)
            .timeout(timeout)
            .resetTimeout(resetTimeout)
            .fallback(fallback)
            .isFailure(isFailure)
            .enabled(enabled);
    }
    
    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration resetTimeout = Duration.ofSeconds(60);
        private Function<Throwable, ?> fallback;
        private Predicate<Throwable> isFailure = error -> true;
        private boolean enabled = true;
        
        public Builder failureThreshold(int threshold) {
            if (threshold <= 0) {
                throw new IllegalArgumentException("Failure threshold must be positive");
            }
            this.failureThreshold = threshold;
            return this;
        }
        
        public Builder successThreshold(int threshold) {
            if (threshold <= 0) {
                throw new IllegalArgumentException("Success threshold must be positive");
            }
            this.successThreshold = threshold;
            return this;
        }
        
        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }
        
        public Builder resetTimeout(Duration resetTimeout) {
            if (resetTimeout == null || resetTimeout.isNegative()) {
                throw new IllegalArgumentException("Reset timeout must not be negative");
            }
            this.resetTimeout = resetTimeout;
            return this;
        }
        
        public Builder fallback(Function<Throwable, ?> fallback) {
            this.fallback = fallback;
            return this;
        }
        
        public Builder isFailure(Predicate<Throwable> isFailure) {
            this.isFailure = isFailure != null ? isFailure : error -> true;
            return this;
        }
        
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }
        
        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(this);
        }
    }
}
