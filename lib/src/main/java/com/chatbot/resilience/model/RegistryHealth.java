package com.chatbot.resilience.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate health of all breakers in a registry. The overall status is the worst
 * status of any breaker.
 */
public class RegistryHealth {
    
    private final HealthStatus status;
    private final Map<String, CircuitHealth> breakers;
    
    public RegistryHealth(HealthStatus status, Map<String, CircuitHealth> breakers) {
        this.status = status;
        this.breakers = Collections.unmodifiableMap(new LinkedHashMap<>(breakers));
    }
    
    public HealthStatus getStatus() {
        return status;
    }
    
    public Map<String, CircuitHealth> getBreakers() {
        return breakers;
    }
    
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
    
    @Override
    public String toString() {
        return String.format("RegistryHealth{status=%s, breakers=%d}", status, breakers.size());
    }
}
