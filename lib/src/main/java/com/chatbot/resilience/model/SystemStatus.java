package com.chatbot.resilience.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status report of the degradation coordinator.
 */
public class SystemStatus {
    
    private final DegradationLevel level;
    private final Instant timestamp;
    private final Map<String, ServiceInfo> services;
    private final int queuedWrites;
    private final int cacheEntries;
    
    public SystemStatus(DegradationLevel level, Instant timestamp, Map<String, ServiceInfo> services,
                        int queuedWrites, int cacheEntries) {
        this.level = level;
        this.timestamp = timestamp;
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        this.queuedWrites = queuedWrites;
        this.cacheEntries = cacheEntries;
    }
    
    public DegradationLevel getLevel() {
        return level;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public Map<String, ServiceInfo> getServices() {
        return services;
    }
    
    public int getQueuedWrites() {
        return queuedWrites;
    }
    
    public int getCacheEntries() {
        return cacheEntries;
    }
    
    /**
     * The system counts as healthy while it can still serve requests.
     * 
     * @return true unless the level is CRITICAL or OFFLINE
     */
    public boolean isHealthy() {
        return level == DegradationLevel.NORMAL || level == DegradationLevel.DEGRADED;
    }
    
    @Override
    public String toString() {
        return String.format("SystemStatus{level=%s, services=%d, queuedWrites=%d, cacheEntries=%d, timestamp=%s}",
            level, services.size(), queuedWrites, cacheEntries, timestamp);
    }
}
