package com.chatbot.resilience.datastore;

import java.util.Optional;

/**
 * Per-query options: routing and retry overrides.
 */
public class QueryOptions {
    
    private static final QueryOptions DEFAULTS = builder().build();
    private static final QueryOptions PRIMARY = builder().usePrimary(true).build();
    
    private final boolean usePrimary;
    private final boolean noRetry;
    private final Integer retries;
    
    private QueryOptions(Builder builder) {
        this.usePrimary = builder.usePrimary;
        this.noRetry = builder.noRetry;
        this.retries = builder.retries;
    }
    
    /**
     * Forces the query onto the primary pool even if it is replica-eligible.
     */
    public boolean isUsePrimary() {
        return usePrimary;
    }
    
    public boolean isNoRetry() {
        return noRetry;
    }
    
    /**
     * Retry count overriding the configured policy.
     */
    public Optional<Integer> getRetries() {
        return Optional.ofNullable(retries);
    }
    
    public static QueryOptions defaults() {
        return DEFAULTS;
    }
    
    public static QueryOptions primary() {
        return PRIMARY;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private boolean usePrimary;
        private boolean noRetry;
        private Integer retries;
        
        public Builder usePrimary(boolean usePrimary) {
            this.usePrimary = usePrimary;
            return this;
        }
        
        public Builder noRetry(boolean noRetry) {
            this.noRetry = noRetry;
            return this;
        }
        
        public Builder retries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("Retries must not be negative");
            }
            this.retries = retries;
            return this;
        }
        
        public QueryOptions build() {
            return new QueryOptions(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("QueryOptions{usePrimary=%s, noRetry=%s, retries=%s}", usePrimary, noRetry, retries);
    }
}
