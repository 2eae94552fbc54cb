package com.chatbot.resilience;

import com.chatbot.resilience.breaker.CircuitBreakerRegistry;
import com.chatbot.resilience.config.DatabaseConfig;
import com.chatbot.resilience.config.DegradationConfig;
import com.chatbot.resilience.datastore.ResilientDataStore;
import com.chatbot.resilience.degradation.DegradationCoordinator;
import com.chatbot.resilience.observability.ResilienceEventPublisher;
import com.chatbot.resilience.observability.ResilienceMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Owns one set of resilience components: event publisher, metrics, breaker registry and
 * degradation coordinator. Collaborators receive the context, or the pieces they need,
 * instead of reaching for process-wide instances.
 * <p>
 * Example:
 * <pre>{@code
 * try (ResilienceContext context = ResilienceContext.builder().build()) {
 *     context.initialize();
 *     context.getBreakers().execute("lavalink", () -> player.load(track));
 * }
 * }</pre>
 */
public class ResilienceContext implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilienceContext.class);
    
    private final ResilienceEventPublisher eventPublisher;
    private final ResilienceMetrics metrics;
    private final CircuitBreakerRegistry breakers;
    private final DegradationCoordinator degradation;
    private final List<ResilientDataStore> dataStores = new ArrayList<>();
    private boolean closed;
    
    private ResilienceContext(Builder builder) {
        this.eventPublisher = new ResilienceEventPublisher(builder.clock);
        this.metrics = new ResilienceMetrics(builder.meterRegistry);
        this.breakers = new CircuitBreakerRegistry(eventPublisher, metrics, builder.clock);
        this.degradation = new DegradationCoordinator(builder.degradationConfig, eventPublisher, metrics,
            builder.clock, builder.replayExecutor);
    }
    
    /**
     * Registers the pre-tuned breakers and the core degradation services. Idempotent.
     */
    public void initialize() {
        breakers.initialize();
        degradation.initialize();
        logger.info("Resilience context initialized with {} circuit breakers", breakers.size());
    }
    
    /**
     * Creates a Hikari-backed data store bound to this context's coordinator and metrics.
     * Pool events are forwarded to the event publisher, and the store is closed with the context.
     * The caller still has to {@link ResilientDataStore#initialize() initialize} it.
     */
    public synchronized ResilientDataStore createDataStore(DatabaseConfig config) {
        ResilientDataStore store = ResilientDataStore.create(config, degradation, metrics);
        store.getPoolMonitor().addListener(eventPublisher::publishPoolEvent);
        dataStores.add(store);
        return store;
    }
    
    public ResilienceEventPublisher getEventPublisher() {
        return eventPublisher;
    }
    
    public ResilienceMetrics getMetrics() {
        return metrics;
    }
    
    public CircuitBreakerRegistry getBreakers() {
        return breakers;
    }
    
    public DegradationCoordinator getDegradation() {
        return degradation;
    }
    
    /**
     * Clears breaker and degradation state so the context can be initialized again.
     */
    public void reset() {
        breakers.shutdown();
        degradation.shutdown();
    }
    
    public synchronized boolean isClosed() {
        return closed;
    }
    
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (ResilientDataStore store : dataStores) {
            try {
                store.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing data store", e);
            }
        }
        dataStores.clear();
        breakers.shutdown();
        degradation.close();
        eventPublisher.close();
        logger.info("Resilience context closed");
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Clock clock = Clock.systemUTC();
        private MeterRegistry meterRegistry;
        private DegradationConfig degradationConfig = DegradationConfig.defaultConfig();
        private Executor replayExecutor;
        
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }
        
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }
        
        public Builder degradationConfig(DegradationConfig degradationConfig) {
            this.degradationConfig = degradationConfig;
            return this;
        }
        
        /**
         * Executor for replaying queued writes. Defaults to a daemon thread owned by the coordinator.
         */
        public Builder replayExecutor(Executor replayExecutor) {
            this.replayExecutor = replayExecutor;
            return this;
        }
        
        public ResilienceContext build() {
            if (meterRegistry == null) {
                meterRegistry = new SimpleMeterRegistry();
            }
            return new ResilienceContext(this);
        }
    }
}
