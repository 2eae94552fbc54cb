package com.chatbot.resilience.config;

import java.time.Duration;

/**
 * Retry policy for transient database errors: exponential backoff with jitter.
 */
public class RetryPolicyConfig {
    
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    
    private RetryPolicyConfig(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.jitterFactor = builder.jitterFactor;
    }
    
    /**
     * Retries after the first attempt; 0 disables retrying.
     */
    public int getMaxRetries() {
        return maxRetries;
    }
    
    public Duration getBaseDelay() {
        return baseDelay;
    }
    
    public Duration getMaxDelay() {
        return maxDelay;
    }
    
    /**
     * Relative jitter applied to each backoff delay, 0.25 meaning plus or minus 25%.
     */
    public double getJitterFactor() {
        return jitterFactor;
    }
    
    public static RetryPolicyConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double jitterFactor = 0.25;
        
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }
        
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }
        
        public Builder jitterFactor(double jitterFactor) {
            if (jitterFactor < 0 || jitterFactor >= 1) {
                throw new IllegalArgumentException("Jitter factor must be in [0, 1)");
            }
            this.jitterFactor = jitterFactor;
            return this;
        }
        
        public RetryPolicyConfig build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay must not exceed max delay");
            }
            return new RetryPolicyConfig(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("RetryPolicyConfig{maxRetries=%d, baseDelay=%s, maxDelay=%s, jitter=%.2f}",
            maxRetries, baseDelay, maxDelay, jitterFactor);
    }
}
