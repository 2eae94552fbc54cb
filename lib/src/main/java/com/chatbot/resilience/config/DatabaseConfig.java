package com.chatbot.resilience.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for the resilient data store: endpoints, pool timeouts, retry policy
 * and failure handling thresholds.
 */
public class DatabaseConfig {
    
    private final DatabaseEndpoint primary;
    private final DatabaseEndpoint replica;
    private final Duration idleTimeout;
    private final Duration connectionTimeout;
    private final Duration queryTimeout;
    private final RetryPolicyConfig retryPolicy;
    private final int maxConnectionFailures;
    private final Duration slowQueryThreshold;
    private final Duration poolMonitorInterval;
    private final double highUtilizationThreshold;
    
    private DatabaseConfig(Builder builder) {
        this.primary = builder.primary;
        this.replica = builder.replica;
        this.idleTimeout = builder.idleTimeout;
        this.connectionTimeout = builder.connectionTimeout;
        this.queryTimeout = builder.queryTimeout;
        this.retryPolicy = builder.retryPolicy;
        this.maxConnectionFailures = builder.maxConnectionFailures;
        this.slowQueryThreshold = builder.slowQueryThreshold;
        this.poolMonitorInterval = builder.poolMonitorInterval;
        this.highUtilizationThreshold = builder.highUtilizationThreshold;
    }
    
    public DatabaseEndpoint getPrimary() {
        return primary;
    }
    
    public Optional<DatabaseEndpoint> getReplica() {
        return Optional.ofNullable(replica);
    }
    
    public Duration getIdleTimeout() {
        return idleTimeout;
    }
    
    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }
    
    public Duration getQueryTimeout() {
        return queryTimeout;
    }
    
    public RetryPolicyConfig getRetryPolicy() {
        return retryPolicy;
    }
    
    public int getMaxConnectionFailures() {
        return maxConnectionFailures;
    }
    
    public Duration getSlowQueryThreshold() {
        return slowQueryThreshold;
    }
    
    public Duration getPoolMonitorInterval() {
        return poolMonitorInterval;
    }
    
    public double getHighUtilizationThreshold() {
        return highUtilizationThreshold;
    }
    
    public static DatabaseConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Builds a configuration from environment variables.
     * Replica settings fall back to the primary's where unset; the replica is only
     * configured when {@code DB_READ_HOST} is present.
     * 
     * @param env the environment, usually {@code System.getenv()}
     * @return the configuration
     * @throws IllegalArgumentException if a numeric variable cannot be parsed
     */
    public static DatabaseConfig fromEnvironment(Map<String, String> env) {
        String host = env.getOrDefault("DB_HOST", "localhost");
        int port = intVar(env, "DB_PORT", 5432);
        String user = env.getOrDefault("DB_USER", "postgres");
        String password = env.getOrDefault("DB_PASSWORD", "");
        String database = env.getOrDefault("DB_NAME", "chatbot");
        
        Builder builder = builder()
            .primary(DatabaseEndpoint.builder()
                .host(host)
                .port(port)
                .user(user)
                .password(password)
                .database(database)
                .minPoolSize(intVar(env, "DB_POOL_MIN", 2))
                .maxPoolSize(intVar(env, "DB_POOL_MAX", 15))
                .build())
            .queryTimeout(Duration.ofMillis(intVar(env, "DB_QUERY_TIMEOUT", 30000)));
        
        String readHost = env.get("DB_READ_HOST");
        if (readHost != null && !readHost.isBlank()) {
            builder.replica(DatabaseEndpoint.builder()
                .host(readHost)
                .port(intVar(env, "DB_READ_PORT", port))
                .user(env.getOrDefault("DB_READ_USER", user))
                .password(env.getOrDefault("DB_READ_PASSWORD", password))
                .database(database)
                .minPoolSize(intVar(env, "DB_READ_POOL_MIN", 2))
                .maxPoolSize(intVar(env, "DB_READ_POOL_MAX", 20))
                .readOnly(true)
                .build());
        }
        return builder.build();
    }
    
    private static int intVar(Map<String, String> env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }
    
    public static class Builder {
        private DatabaseEndpoint primary = DatabaseEndpoint.builder().build();
        private DatabaseEndpoint replica;
        private Duration idleTimeout = Duration.ofSeconds(30);
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private Duration queryTimeout = Duration.ofSeconds(30);
        private RetryPolicyConfig retryPolicy = RetryPolicyConfig.defaultConfig();
        private int maxConnectionFailures = 3;
        private Duration slowQueryThreshold = Duration.ofSeconds(1);
        private Duration poolMonitorInterval = Duration.ofSeconds(10);
        private double highUtilizationThreshold = 0.8;
        
        public Builder primary(DatabaseEndpoint primary) {
            if (primary == null) {
                throw new IllegalArgumentException("Primary endpoint is required");
            }
            this.primary = primary;
            return this;
        }
        
        public Builder replica(DatabaseEndpoint replica) {
            this.replica = replica;
            return this;
        }
        
        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }
        
        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }
        
        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }
        
        public Builder retryPolicy(RetryPolicyConfig retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }
        
        public Builder maxConnectionFailures(int maxConnectionFailures) {
            if (maxConnectionFailures <= 0) {
                throw new IllegalArgumentException("Max connection failures must be positive");
            }
            this.maxConnectionFailures = maxConnectionFailures;
            return this;
        }
        
        public Builder slowQueryThreshold(Duration slowQueryThreshold) {
            this.slowQueryThreshold = slowQueryThreshold;
            return this;
        }
        
        public Builder poolMonitorInterval(Duration poolMonitorInterval) {
            this.poolMonitorInterval = poolMonitorInterval;
            return this;
        }
        
        public Builder highUtilizationThreshold(double highUtilizationThreshold) {
            if (highUtilizationThreshold <= 0 || highUtilizationThreshold > 1) {
                throw new IllegalArgumentException("Utilization threshold must be in (0, 1]");
            }
            this.highUtilizationThreshold = highUtilizationThreshold;
            return this;
        }
        
        public DatabaseConfig build() {
            return new DatabaseConfig(this);
        }
    }
}
