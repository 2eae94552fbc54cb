package com.chatbot.resilience;

import com.chatbot.resilience.config.DatabaseConfig;
import com.chatbot.resilience.config.DegradationConfig;
import com.chatbot.resilience.datastore.ResilientDataStore;
import com.chatbot.resilience.degradation.DegradationCoordinator;
import com.chatbot.resilience.model.DegradationLevel;
import com.chatbot.resilience.model.ServiceState;
import com.chatbot.resilience.observability.ResilienceEventPublisher;
import com.chatbot.resilience.pool.PoolEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceContextTest {
    
    private SimpleMeterRegistry meterRegistry;
    private ResilienceContext context;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        context = ResilienceContext.builder()
            .clock(new MutableClock())
            .meterRegistry(meterRegistry)
            .degradationConfig(DegradationConfig.builder().maxQueueSize(10).build())
            .replayExecutor(Runnable::run)
            .build();
    }
    
    @AfterEach
    void tearDown() {
        context.close();
    }
    
    @Test
    void testInitializeWiresComponents() {
        context.initialize();
        context.initialize();
        
        assertTrue(context.getBreakers().get("lavalink").isPresent());
        assertEquals(Optional.of(ServiceState.HEALTHY),
            context.getDegradation().getServiceState(DegradationCoordinator.DISCORD));
        assertEquals("ok", context.getBreakers()
            .execute("lavalink", () -> CompletableFuture.completedFuture("ok")).join());
    }
    
    @Test
    void testDegradationEventsReachPublisherAndMetrics() {
        List<ResilienceEventPublisher.LevelChangeEvent> levels = new ArrayList<>();
        context.getEventPublisher().subscribeToLevelChanges(levels::add);
        context.initialize();
        
        context.getDegradation().markUnavailable(DegradationCoordinator.DATABASE, "down");
        
        assertEquals(DegradationLevel.CRITICAL, levels.get(levels.size() - 1).newLevel());
        assertEquals(2.0, meterRegistry.get("chatbot.degradation.level").gauge().value());
    }
    
    @Test
    void testIndependentContextsDoNotShareState() {
        try (ResilienceContext other = ResilienceContext.builder().replayExecutor(Runnable::run).build()) {
            context.initialize();
            other.initialize();
            
            context.getBreakers().get("redis").orElseThrow().trip();
            
            assertTrue(context.getBreakers().get("redis").orElseThrow().isOpen());
            assertTrue(other.getBreakers().get("redis").orElseThrow().isClosed());
        }
    }
    
    @Test
    void testDataStorePoolEventsArePublished() {
        List<ResilienceEventPublisher.PoolEventNotification> received = new ArrayList<>();
        context.getEventPublisher().subscribeToPoolEvents(received::add);
        
        ResilientDataStore store = context.createDataStore(DatabaseConfig.defaultConfig());
        store.getPoolMonitor().notifyListeners("primary", PoolEvent.POOL_EXHAUSTED, "2 clients waiting");
        
        assertEquals(1, received.size());
        assertEquals(PoolEvent.POOL_EXHAUSTED, received.get(0).event());
        assertFalse(store.isConnected());
    }
    
    @Test
    void testResetAllowsReinitialization() {
        context.initialize();
        context.getDegradation().markDegraded(DegradationCoordinator.REDIS, "slow");
        
        context.reset();
        assertEquals(0, context.getBreakers().size());
        assertTrue(context.getDegradation().getServiceState(DegradationCoordinator.REDIS).isEmpty());
        
        context.initialize();
        assertEquals(Optional.of(ServiceState.HEALTHY),
            context.getDegradation().getServiceState(DegradationCoordinator.REDIS));
    }
    
    @Test
    void testBreakerGaugeTracksBreakersCreatedAfterReset() {
        context.initialize();
        context.reset();
        context.initialize();

        context.getBreakers().get("lavalink").orElseThrow().trip();

        assertEquals(2.0, meterRegistry.get("chatbot.circuit.state").tag("name", "lavalink").gauge().value());
        assertEquals(context.getBreakers().size(), meterRegistry.find("chatbot.circuit.state").gauges().size());
    }

    @Test
    void testCloseIsIdempotent() {
        context.initialize();
        context.close();
        context.close();
        
        assertTrue(context.isClosed());
        assertTrue(context.getEventPublisher().isClosed());
    }
}
