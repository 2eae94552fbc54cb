package com.chatbot.resilience.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A deferred write waiting for its service to recover.
 * Entries are immutable; a failed replay produces a copy with a higher retry count.
 */
public record QueuedWrite(
        long id,
        String service,
        String operation,
        Object payload,
        Map<String, Object> options,
        Instant queuedAt,
        int retryCount) {
    
    public QueuedWrite {
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
    
    public QueuedWrite incrementRetries() {
        return new QueuedWrite(id, service, operation, payload, options, queuedAt, retryCount + 1);
    }
}
