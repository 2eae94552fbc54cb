package com.chatbot.resilience.breaker;

import com.chatbot.resilience.config.BreakerPolicies;
import com.chatbot.resilience.config.CircuitBreakerConfig;
import com.chatbot.resilience.model.CircuitBreakerMetrics;
import com.chatbot.resilience.model.CircuitBreakerState;
import com.chatbot.resilience.model.CircuitHealth;
import com.chatbot.resilience.model.HealthStatus;
import com.chatbot.resilience.model.RegistryHealth;
import com.chatbot.resilience.model.RegistrySummary;
import com.chatbot.resilience.observability.ResilienceEventPublisher;
import com.chatbot.resilience.observability.ResilienceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Named collection of circuit breakers.
 * <p>
 * Protection is opportunistic: executing through an unknown breaker name runs the
 * operation unprotected instead of failing.
 */
public class CircuitBreakerRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);
    
    private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
    private final ResilienceEventPublisher eventPublisher;
    private final ResilienceMetrics metrics;
    private final Clock clock;
    private final CircuitBreakerListener registryListener = new RegistryListener();
    private boolean initialized;
    
    public CircuitBreakerRegistry() {
        this(null, null, Clock.systemUTC());
    }
    
    /**
     * @param eventPublisher receives breaker events, may be null
     * @param metrics records breaker metrics, may be null
     * @param clock time source handed to every breaker created here
     */
    public CircuitBreakerRegistry(ResilienceEventPublisher eventPublisher, ResilienceMetrics metrics, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
    }
    
    /**
     * Registers every pre-tuned policy from {@link BreakerPolicies}. Idempotent.
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        BreakerPolicies.all().forEach(this::register);
        initialized = true;
        logger.info("Initialized {} circuit breakers", breakers.size());
    }
    
    /**
     * Registers a breaker, or returns the existing one if the name is taken.
     *
     * @param name the breaker name
     * @param config the breaker configuration, ignored for an existing name
     * @return the breaker registered under the name
     */
    public synchronized CircuitBreaker register(String name, CircuitBreakerConfig config) {
        CircuitBreaker existing = breakers.get(name);
        if (existing != null) {
            logger.warn("Breaker '{}' already exists, returning existing", name);
            return existing;
        }
        
        CircuitBreaker breaker = new CircuitBreaker(name, config, clock);
        breaker.addListener(registryListener);
        if (metrics != null) {
            metrics.registerBreaker(breaker);
        }
        breakers.put(name, breaker);
        logger.debug("Registered circuit breaker '{}' (failureThreshold={}, timeout={}ms)",
            name, config.getFailureThreshold(), config.getTimeout().toMillis());
        return breaker;
    }
    
    public CircuitBreaker register(String name) {
        return register(name, CircuitBreakerConfig.defaultConfig());
    }
    
    public synchronized Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }
    
    public synchronized Set<String> getNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(breakers.keySet()));
    }
    
    /**
     * Executes an operation through the named breaker.
     *
     * @param name the breaker name
     * @param operation supplies the call to protect
     * @return the breaker's result, or the unprotected result if no breaker has that name
     */
    public <T> CompletableFuture<T> execute(String name, Supplier<? extends CompletionStage<T>> operation) {
        Optional<CircuitBreaker> breaker = get(name);
        if (breaker.isEmpty()) {
            logger.warn("Breaker '{}' not found, executing without protection", name);
            return CircuitBreaker.invoke(operation);
        }
        return breaker.get().execute(operation);
    }
    
    /**
     * Worst-of health across all breakers, with per-breaker detail.
     */
    public synchronized RegistryHealth getHealth() {
        Map<String, CircuitHealth> details = new LinkedHashMap<>();
        boolean hasUnhealthy = false;
        boolean hasDegraded = false;
        
        for (Map.Entry<String, CircuitBreaker> entry : breakers.entrySet()) {
            CircuitHealth health = entry.getValue().getHealth();
            details.put(entry.getKey(), health);
            if (health.status() == HealthStatus.UNHEALTHY) {
                hasUnhealthy = true;
            } else if (health.status() == HealthStatus.DEGRADED) {
                hasDegraded = true;
            }
        }
        
        HealthStatus status = hasUnhealthy ? HealthStatus.UNHEALTHY
            : hasDegraded ? HealthStatus.DEGRADED
            : HealthStatus.HEALTHY;
        return new RegistryHealth(status, details);
    }
    
    public synchronized Map<String, CircuitBreakerMetrics> getMetrics() {
        Map<String, CircuitBreakerMetrics> result = new LinkedHashMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.getMetrics()));
        return result;
    }
    
    public synchronized RegistrySummary getSummary() {
        int closed = 0;
        int open = 0;
        int halfOpen = 0;
        for (CircuitBreaker breaker : breakers.values()) {
            CircuitBreakerState state = breaker.getState();
            switch (state) {
                case CLOSED -> closed++;
                case OPEN -> open++;
                case HALF_OPEN -> halfOpen++;
            }
        }
        return new RegistrySummary(breakers.size(), closed, open, halfOpen);
    }
    
    public synchronized void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        logger.info("All circuits reset");
    }
    
    public synchronized void resetAllMetrics() {
        breakers.values().forEach(CircuitBreaker::resetMetrics);
    }
    
    public synchronized int size() {
        return breakers.size();
    }
    
    /**
     * Detaches and forgets every breaker. The registry can be initialized again afterwards.
     */
    public synchronized void shutdown() {
        breakers.values().forEach(breaker -> {
            breaker.removeListener(registryListener);
            if (metrics != null) {
                metrics.unregisterBreaker(breaker.getName());
            }
        });
        breakers.clear();
        initialized = false;
        logger.info("Circuit breaker registry shut down");
    }
    
    /**
     * Logs transitions and forwards breaker events to the publisher and metrics.
     */
    private class RegistryListener implements CircuitBreakerListener {
        
        @Override
        public void onStateChange(CircuitStateChangeEvent event) {
            if (event.to() == CircuitBreakerState.OPEN) {
                logger.warn("Circuit '{}' OPENED - service degraded", event.name());
            } else if (event.isRecovery()) {
                logger.info("Circuit '{}' recovered", event.name());
            } else {
                logger.info("Circuit '{}' state changed: {} -> {}", event.name(), event.from(), event.to());
            }
            
            if (eventPublisher != null) {
                eventPublisher.publishStateChange(event);
            }
            if (metrics != null) {
                metrics.recordStateTransition(event);
            }
        }
        
        @Override
        public void onCallRejected(String name, CircuitBreakerState state) {
            if (eventPublisher != null) {
                eventPublisher.publishCallRejected(name, state);
            }
            if (metrics != null) {
                metrics.recordRejection(name);
            }
        }
    }
}
