package com.chatbot.resilience.observability;

import com.chatbot.resilience.breaker.CircuitBreaker;
import com.chatbot.resilience.breaker.CircuitStateChangeEvent;
import com.chatbot.resilience.model.CircuitBreakerState;
import com.chatbot.resilience.model.DegradationLevel;
import com.chatbot.resilience.model.ServiceState;
import com.chatbot.resilience.pool.PoolSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for breakers, degradation and database access.
 */
public class ResilienceMetrics {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilienceMetrics.class);
    
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, PoolGauges> poolGauges = new ConcurrentHashMap<>();
    private final Map<String, BreakerGauge> breakerGauges = new HashMap<>();
    
    private final AtomicInteger degradationLevel = new AtomicInteger(DegradationLevel.NORMAL.ordinal());
    private final AtomicInteger writeQueueSize = new AtomicInteger();
    private final Counter queryRetries;
    private final Counter droppedWrites;
    
    public ResilienceMetrics() {
        this(new SimpleMeterRegistry());
    }
    
    public ResilienceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        Gauge.builder("chatbot.degradation.level", degradationLevel, AtomicInteger::doubleValue)
            .description("System degradation level (0=NORMAL, 1=DEGRADED, 2=CRITICAL, 3=OFFLINE)")
            .register(meterRegistry);
        
        Gauge.builder("chatbot.degradation.queue.size", writeQueueSize, AtomicInteger::doubleValue)
            .description("Writes waiting for their service to recover")
            .register(meterRegistry);
        
        this.queryRetries = Counter.builder("chatbot.db.query.retries")
            .description("Database query retries after transient errors")
            .register(meterRegistry);
        
        this.droppedWrites = Counter.builder("chatbot.degradation.queue.dropped")
            .description("Queued writes dropped on overflow or after exhausting replay attempts")
            .register(meterRegistry);
        
        logger.debug("Resilience metrics initialized");
    }
    
    /**
     * Registers a state gauge for a breaker (0=CLOSED, 1=HALF_OPEN, 2=OPEN).
     * Registering the same breaker twice has no effect. A different instance under a
     * registered name replaces the old gauge.
     */
    public synchronized void registerBreaker(CircuitBreaker breaker) {
        BreakerGauge existing = breakerGauges.get(breaker.getName());
        if (existing != null) {
            if (existing.breaker() == breaker) {
                return;
            }
            meterRegistry.remove(existing.gauge());
        }
        Gauge gauge = Gauge.builder("chatbot.circuit.state", breaker, b -> stateValue(b.getState()))
            .tag("name", breaker.getName())
            .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
            .register(meterRegistry);
        breakerGauges.put(breaker.getName(), new BreakerGauge(breaker, gauge));
    }
    
    /**
     * Removes the state gauge of a breaker that is no longer in use.
     */
    public synchronized void unregisterBreaker(String name) {
        BreakerGauge removed = breakerGauges.remove(name);
        if (removed != null) {
            meterRegistry.remove(removed.gauge());
        }
    }
    
    public void recordStateTransition(CircuitStateChangeEvent event) {
        Counter.builder("chatbot.circuit.transitions")
            .tag("name", event.name())
            .tag("from", event.from().name())
            .tag("to", event.to().name())
            .description("Circuit breaker state transitions")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordRejection(String breakerName) {
        Counter.builder("chatbot.circuit.rejections")
            .tag("name", breakerName)
            .description("Calls rejected by an open circuit breaker")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordServiceStateChange(String service, ServiceState newState) {
        Counter.builder("chatbot.degradation.service.transitions")
            .tag("service", service)
            .tag("state", newState.name())
            .description("Service state changes")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordLevel(DegradationLevel level) {
        degradationLevel.set(level.ordinal());
    }
    
    public void recordFallback(String service, String source) {
        Counter.builder("chatbot.degradation.fallbacks")
            .tag("service", service)
            .tag("source", source)
            .description("Fallback results served instead of the primary operation")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordQueueSize(int size) {
        writeQueueSize.set(size);
    }
    
    public void recordDroppedWrite() {
        droppedWrites.increment();
    }
    
    public void recordQuery(String poolName, Duration latency, boolean success) {
        Timer.builder("chatbot.db.query.latency")
            .tag("pool", poolName)
            .tag("outcome", success ? "success" : "failure")
            .description("Database query latency")
            .register(meterRegistry)
            .record(latency);
    }
    
    public void recordQueryRetry() {
        queryRetries.increment();
    }
    
    public void recordPoolSnapshot(PoolSnapshot snapshot) {
        poolGauges.computeIfAbsent(snapshot.poolName(), name -> new PoolGauges(name, meterRegistry))
            .update(snapshot);
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    static double stateValue(CircuitBreakerState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
    
    /**
     * Gauges for one connection pool.
     */
    private static class PoolGauges {
        private final AtomicInteger total = new AtomicInteger();
        private final AtomicInteger idle = new AtomicInteger();
        private final AtomicInteger active = new AtomicInteger();
        private final AtomicInteger waiting = new AtomicInteger();
        
        PoolGauges(String poolName, MeterRegistry registry) {
            register(registry, poolName, "total", total);
            register(registry, poolName, "idle", idle);
            register(registry, poolName, "active", active);
            register(registry, poolName, "waiting", waiting);
        }
        
        private static void register(MeterRegistry registry, String poolName, String state, AtomicInteger value) {
            Gauge.builder("chatbot.db.pool.connections", value, AtomicInteger::doubleValue)
                .tag("pool", poolName)
                .tag("state", state)
                .description("Database pool connections by state")
                .register(registry);
        }
        
        void update(PoolSnapshot snapshot) {
            total.set(snapshot.total());
            idle.set(snapshot.idle());
            active.set(snapshot.active());
            waiting.set(snapshot.waiting());
        }
    }
    
    private record BreakerGauge(CircuitBreaker breaker, Gauge gauge) {
    }
}
