package com.chatbot.resilience.config;

/**
 * Configuration for the degradation coordinator's in-memory structures.
 */
public class DegradationConfig {
    
    private final int maxQueueSize;
    private final int maxCacheSize;
    private final int maxReplayAttempts;
    
    private DegradationConfig(Builder builder) {
        this.maxQueueSize = builder.maxQueueSize;
        this.maxCacheSize = builder.maxCacheSize;
        this.maxReplayAttempts = builder.maxReplayAttempts;
    }
    
    public int getMaxQueueSize() {
        return maxQueueSize;
    }
    
    public int getMaxCacheSize() {
        return maxCacheSize;
    }
    
    public int getMaxReplayAttempts() {
        return maxReplayAttempts;
    }
    
    public static DegradationConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private int maxQueueSize = 1000;
        private int maxCacheSize = 1000;
        private int maxReplayAttempts = 3;
        
        public Builder maxQueueSize(int maxQueueSize) {
            if (maxQueueSize <= 0) {
                throw new IllegalArgumentException("Max queue size must be positive");
            }
            this.maxQueueSize = maxQueueSize;
            return this;
        }
        
        public Builder maxCacheSize(int maxCacheSize) {
            if (maxCacheSize <= 0) {
                throw new IllegalArgumentException("Max cache size must be positive");
            }
            this.maxCacheSize = maxCacheSize;
            return this;
        }
        
        public Builder maxReplayAttempts(int maxReplayAttempts) {
            if (maxReplayAttempts <= 0) {
                throw new IllegalArgumentException("Max replay attempts must be positive");
            }
            this.maxReplayAttempts = maxReplayAttempts;
            return this;
        }
        
        public DegradationConfig build() {
            return new DegradationConfig(this);
        }
    }
}
