package com.chatbot.resilience.observability;

import com.chatbot.resilience.breaker.CircuitBreaker;
import com.chatbot.resilience.config.CircuitBreakerConfig;
import com.chatbot.resilience.model.DegradationLevel;
import com.chatbot.resilience.model.ServiceState;
import com.chatbot.resilience.pool.PoolSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceMetricsTest {
    
    private SimpleMeterRegistry registry;
    private ResilienceMetrics metrics;
    
    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ResilienceMetrics(registry);
    }
    
    @Test
    void testBreakerGaugeFollowsState() {
        CircuitBreaker breaker = new CircuitBreaker("redis", CircuitBreakerConfig.defaultConfig());
        metrics.registerBreaker(breaker);
        metrics.registerBreaker(breaker);
        
        assertEquals(0.0, registry.get("chatbot.circuit.state").tag("name", "redis").gauge().value());
        breaker.trip();
        assertEquals(2.0, registry.get("chatbot.circuit.state").tag("name", "redis").gauge().value());
        assertEquals(1, registry.find("chatbot.circuit.state").gauges().size());
    }
    
    @Test
    void testReplacedBreakerGetsFreshGauge() {
        CircuitBreaker first = new CircuitBreaker("redis", CircuitBreakerConfig.defaultConfig());
        metrics.registerBreaker(first);
        metrics.unregisterBreaker("redis");
        assertNull(registry.find("chatbot.circuit.state").tag("name", "redis").gauge());

        CircuitBreaker second = new CircuitBreaker("redis", CircuitBreakerConfig.defaultConfig());
        metrics.registerBreaker(second);
        first.trip();
        assertEquals(0.0, registry.get("chatbot.circuit.state").tag("name", "redis").gauge().value());

        second.trip();
        assertEquals(2.0, registry.get("chatbot.circuit.state").tag("name", "redis").gauge().value());
    }

    @Test
    void testDegradationMeters() {
        metrics.recordLevel(DegradationLevel.CRITICAL);
        metrics.recordQueueSize(7);
        metrics.recordDroppedWrite();
        metrics.recordServiceStateChange("lavalink", ServiceState.DEGRADED);
        metrics.recordFallback("lavalink", "cache");
        metrics.recordFallback("lavalink", "cache");
        
        assertEquals(2.0, registry.get("chatbot.degradation.level").gauge().value());
        assertEquals(7.0, registry.get("chatbot.degradation.queue.size").gauge().value());
        assertEquals(1.0, registry.get("chatbot.degradation.queue.dropped").counter().count());
        assertEquals(1.0, registry.get("chatbot.degradation.service.transitions")
            .tag("service", "lavalink").tag("state", "DEGRADED").counter().count());
        assertEquals(2.0, registry.get("chatbot.degradation.fallbacks")
            .tag("source", "cache").counter().count());
    }
    
    @Test
    void testQueryAndPoolMeters() {
        metrics.recordQuery("replica", Duration.ofMillis(12), true);
        metrics.recordQuery("replica", Duration.ofMillis(30), false);
        metrics.recordQueryRetry();
        metrics.recordPoolSnapshot(new PoolSnapshot("primary", 10, 3, 7, 1, Instant.now()));
        
        assertEquals(1, registry.get("chatbot.db.query.latency")
            .tag("pool", "replica").tag("outcome", "success").timer().count());
        assertEquals(1, registry.get("chatbot.db.query.latency")
            .tag("outcome", "failure").timer().count());
        assertEquals(1.0, registry.get("chatbot.db.query.retries").counter().count());
        assertEquals(1.0, registry.get("chatbot.db.pool.connections")
            .tag("pool", "primary").tag("state", "waiting").gauge().value());
    }
}
