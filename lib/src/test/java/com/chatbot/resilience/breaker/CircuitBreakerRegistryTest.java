package com.chatbot.resilience.breaker;

import com.chatbot.resilience.MutableClock;
import com.chatbot.resilience.config.BreakerPolicies;
import com.chatbot.resilience.config.CircuitBreakerConfig;
import com.chatbot.resilience.model.CircuitBreakerState;
import com.chatbot.resilience.model.HealthStatus;
import com.chatbot.resilience.model.RegistryHealth;
import com.chatbot.resilience.model.RegistrySummary;
import com.chatbot.resilience.observability.ResilienceEventPublisher;
import com.chatbot.resilience.observability.ResilienceMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerRegistryTest {
    
    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private ResilienceEventPublisher eventPublisher;
    private CircuitBreakerRegistry registry;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        meterRegistry = new SimpleMeterRegistry();
        eventPublisher = new ResilienceEventPublisher(clock);
        registry = new CircuitBreakerRegistry(eventPublisher, new ResilienceMetrics(meterRegistry), clock);
    }
    
    @AfterEach
    void tearDown() {
        registry.shutdown();
        eventPublisher.close();
    }
    
    @Test
    void testInitializeRegistersAllPoliciesOnce() {
        registry.initialize();
        registry.initialize();
        
        assertEquals(BreakerPolicies.all().size(), registry.size());
        assertTrue(registry.get(BreakerPolicies.LAVALINK).isPresent());
        assertTrue(registry.get(BreakerPolicies.DISCORD).isPresent());
        assertTrue(registry.getNames().contains(BreakerPolicies.STEAM));
    }
    
    @Test
    void testRegisterIsIdempotent() {
        CircuitBreaker first = registry.register("custom", CircuitBreakerConfig.defaultConfig());
        CircuitBreaker second = registry.register("custom", CircuitBreakerConfig.builder().failureThreshold(1).build());
        
        assertSame(first, second);
        assertEquals(5, second.getConfig().getFailureThreshold());
    }
    
    @Test
    void testExecuteUnknownBreakerRunsUnprotected() {
        assertEquals("raw", registry.execute("missing", () -> CompletableFuture.completedFuture("raw")).join());
        
        CompletionException error = assertThrows(CompletionException.class, () ->
            registry.execute("missing", () -> CompletableFuture.<String>failedFuture(new IllegalStateException("x"))).join());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(registry.get("missing").isEmpty());
    }
    
    @Test
    void testExecuteThroughNamedBreaker() {
        registry.register("api", CircuitBreakerConfig.builder().failureThreshold(1).build());
        
        assertThrows(CompletionException.class, () ->
            registry.execute("api", () -> CompletableFuture.<String>failedFuture(new RuntimeException("down"))).join());
        
        assertEquals(CircuitBreakerState.OPEN, registry.get("api").orElseThrow().getState());
    }
    
    @Test
    void testLavalinkPolicyFallbackCarriesCode() {
        registry.initialize();
        CircuitBreaker lavalink = registry.get(BreakerPolicies.LAVALINK).orElseThrow();
        lavalink.trip();
        
        CompletionException error = assertThrows(CompletionException.class, () ->
            registry.execute(BreakerPolicies.LAVALINK, () -> CompletableFuture.completedFuture("track")).join());
        
        ServiceUnavailableException unavailable = assertInstanceOf(ServiceUnavailableException.class, error.getCause());
        assertEquals("LAVALINK_UNAVAILABLE", unavailable.getCode());
    }
    
    @Test
    void testHealthIsWorstOfBreakers() {
        registry.register("a");
        registry.register("b");
        assertEquals(HealthStatus.HEALTHY, registry.getHealth().getStatus());
        
        registry.get("b").orElseThrow().trip();
        RegistryHealth health = registry.getHealth();
        
        assertEquals(HealthStatus.UNHEALTHY, health.getStatus());
        assertFalse(health.isHealthy());
        assertEquals(HealthStatus.HEALTHY, health.getBreakers().get("a").status());
        assertEquals(HealthStatus.UNHEALTHY, health.getBreakers().get("b").status());
    }
    
    @Test
    void testSummaryAndResetAll() {
        registry.register("a");
        registry.register("b");
        registry.register("c");
        registry.get("a").orElseThrow().trip();
        
        RegistrySummary summary = registry.getSummary();
        assertEquals(3, summary.total());
        assertEquals(2, summary.closed());
        assertEquals(1, summary.open());
        assertEquals(0, summary.halfOpen());
        
        registry.resetAll();
        assertEquals(3, registry.getSummary().closed());
    }
    
    @Test
    void testStateChangesForwardedToPublisherAndMetrics() {
        List<CircuitStateChangeEvent> events = new ArrayList<>();
        Disposable subscription = eventPublisher.subscribeToStateChanges(events::add);
        
        registry.register("api").trip();
        
        assertEquals(1, events.size());
        assertEquals("api", events.get(0).name());
        assertEquals(1.0, meterRegistry.get("chatbot.circuit.transitions")
            .tag("name", "api").tag("to", "OPEN").counter().count());
        assertEquals(2.0, meterRegistry.get("chatbot.circuit.state").tag("name", "api").gauge().value());
        subscription.dispose();
    }
    
    @Test
    void testRejectionsForwardedToMetrics() {
        registry.register("api").trip();
        
        assertThrows(CompletionException.class, () ->
            registry.execute("api", () -> CompletableFuture.completedFuture("x")).join());
        
        assertEquals(1.0, meterRegistry.get("chatbot.circuit.rejections").tag("name", "api").counter().count());
    }
    
    @Test
    void testShutdownForgetsBreakers() {
        registry.initialize();
        registry.shutdown();
        assertEquals(0, registry.size());
        assertTrue(meterRegistry.find("chatbot.circuit.state").gauges().isEmpty());
        
        registry.initialize();
        assertEquals(BreakerPolicies.all().size(), registry.size());
    }
}
