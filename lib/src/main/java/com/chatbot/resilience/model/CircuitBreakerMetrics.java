package com.chatbot.resilience.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Point-in-time snapshot of a circuit breaker's counters and state.
 */
public class CircuitBreakerMetrics {
    
    private final String name;
    private final CircuitBreakerState state;
    private final int failureCount;
    private final int successCount;
    private final Instant lastFailureTime;
    private final Instant nextAttempt;
    private final long totalRequests;
    private final long successfulRequests;
    private final long failedRequests;
    private final long rejectedRequests;
    private final long timeouts;
    private final long fallbackExecutions;
    private final List<StateChange> stateChanges;
    
    private CircuitBreakerMetrics(Builder builder) {
        this.name = builder.name;
        this.state = builder.state;
        this.failureCount = builder.failureCount;
        this.successCount = builder.successCount;
        this.lastFailureTime = builder.lastFailureTime;
        this.nextAttempt = builder.nextAttempt;
        this.totalRequests = builder.totalRequests;
        this.successfulRequests = builder.successfulRequests;
        this.failedRequests = builder.failedRequests;
        this.rejectedRequests = builder.rejectedRequests;
        this.timeouts = builder.timeouts;
        this.fallbackExecutions = builder.fallbackExecutions;
        this.stateChanges = List.copyOf(builder.stateChanges);
    }
    
    public String getName() {
        return name;
    }
    
    public CircuitBreakerState getState() {
        return state;
    }
    
    public int getFailureCount() {
        return failureCount;
    }
    
    public int getSuccessCount() {
        return successCount;
    }
    
    public Optional<Instant> getLastFailureTime() {
        return Optional.ofNullable(lastFailureTime);
    }
    
    public Optional<Instant> getNextAttempt() {
        return Optional.ofNullable(nextAttempt);
    }
    
    public long getTotalRequests() {
        return totalRequests;
    }
    
    public long getSuccessfulRequests() {
        return successfulRequests;
    }
    
    public long getFailedRequests() {
        return failedRequests;
    }
    
    public long getRejectedRequests() {
        return rejectedRequests;
    }
    
    public long getTimeouts() {
        return timeouts;
    }
    
    public long getFallbackExecutions() {
        return fallbackExecutions;
    }
    
    public List<StateChange> getStateChanges() {
        return stateChanges;
    }
    
    /**
     * Gets the success rate as a two-decimal percentage, e.g. {@code "66.67%"}.
     * 
     * @return the formatted success rate, or {@code "N/A"} when no requests were made
     */
    public String getSuccessRate() {
        if (totalRequests == 0) {
            return "N/A";
        }
        return String.format(Locale.ROOT, "%.2f%%", (successfulRequests * 100.0) / totalRequests);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String name;
        private CircuitBreakerState state = CircuitBreakerState.CLOSED;
        private int failureCount;
        private int successCount;
        private Instant lastFailureTime;
        private Instant nextAttempt;
        private long totalRequests;
        private long successfulRequests;
        private long failedRequests;
        private long rejectedRequests;
        private long timeouts;
        private long fallbackExecutions;
        private List<StateChange> stateChanges = List.of();
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder state(CircuitBreakerState state) {
            this.state = state;
            return this;
        }
        
        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }
        
        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }
        
        public Builder lastFailureTime(Instant lastFailureTime) {
            this.lastFailureTime = lastFailureTime;
            return this;
        }
        
        public Builder nextAttempt(Instant nextAttempt) {
            this.nextAttempt = nextAttempt;
            return this;
        }
        
        public Builder totalRequests(long totalRequests) {
            this.totalRequests = totalRequests;
            return this;
        }
        
        public Builder successfulRequests(long successfulRequests) {
            this.successfulRequests = successfulRequests;
            return this;
        }
        
        public Builder failedRequests(long failedRequests) {
            this.failedRequests = failedRequests;
            return this;
        }
        
        public Builder rejectedRequests(long rejectedRequests) {
            this.rejectedRequests = rejectedRequests;
            return this;
        }
        
        public Builder timeouts(long timeouts) {
            this.timeouts = timeouts;
            return this;
        }
        
        public Builder fallbackExecutions(long fallbackExecutions) {
            this.fallbackExecutions = fallbackExecutions;
            return this;
        }
        
        public Builder stateChanges(List<StateChange> stateChanges) {
            this.stateChanges = stateChanges;
            return this;
        }
        
        public CircuitBreakerMetrics build() {
            return new CircuitBreakerMetrics(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format(
            "CircuitBreakerMetrics{name='%s', state=%s, total=%d, successful=%d, failed=%d, " +
            "rejected=%d, timeouts=%d, fallbacks=%d, successRate=%s}",
            name, state, totalRequests, successfulRequests, failedRequests,
            rejectedRequests, timeouts, fallbackExecutions, getSuccessRate()
        );
    }
}
