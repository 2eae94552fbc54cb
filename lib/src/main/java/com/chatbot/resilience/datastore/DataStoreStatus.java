package com.chatbot.resilience.datastore;

import com.chatbot.resilience.config.RetryPolicyConfig;

import java.util.Optional;

/**
 * Point-in-time status of a {@link ResilientDataStore}.
 *
 * @param state lower-case coordinator state of the database service, or "unknown"
 * @param failureCount consecutive connection errors
 * @param pendingWrites writes queued for the database service
 */
public record DataStoreStatus(boolean connected,
                              String state,
                              int failureCount,
                              int maxFailures,
                              int pendingWrites,
                              boolean replicaEnabled,
                              String replicaHost,
                              RetryPolicyConfig retryPolicy) {
    
    public Optional<String> getReplicaHost() {
        return Optional.ofNullable(replicaHost);
    }
}
