package com.chatbot.resilience.observability;

import com.chatbot.resilience.breaker.CircuitStateChangeEvent;
import com.chatbot.resilience.model.CircuitBreakerState;
import com.chatbot.resilience.model.DegradationLevel;
import com.chatbot.resilience.model.ServiceState;
import com.chatbot.resilience.pool.PoolEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Publishes breaker, degradation and pool events as reactive streams so logging,
 * metrics and alerting collaborators can subscribe without coupling to the core.
 * <p>
 * Emission is serialized on the publisher's monitor. Events published while a stream
 * has no subscriber are dropped.
 */
public class ResilienceEventPublisher {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilienceEventPublisher.class);
    
    private final Clock clock;
    private final Sinks.Many<CircuitStateChangeEvent> stateChangeSink;
    private final Sinks.Many<CallRejectedEvent> rejectionSink;
    private final Sinks.Many<ServiceStateChangeEvent> serviceStateSink;
    private final Sinks.Many<LevelChangeEvent> levelSink;
    private final Sinks.Many<WriteQueuedEvent> writeQueuedSink;
    private final Sinks.Many<PoolEventNotification> poolEventSink;
    private final ConcurrentMap<String, Boolean> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong subscriberSequence = new AtomicLong();
    private volatile boolean closed;
    
    public ResilienceEventPublisher() {
        this(Clock.systemUTC());
    }
    
    public ResilienceEventPublisher(Clock clock) {
        this.clock = clock;
        this.stateChangeSink = Sinks.many().multicast().directBestEffort();
        this.rejectionSink = Sinks.many().multicast().directBestEffort();
        this.serviceStateSink = Sinks.many().multicast().directBestEffort();
        this.levelSink = Sinks.many().multicast().directBestEffort();
        this.writeQueuedSink = Sinks.many().multicast().directBestEffort();
        this.poolEventSink = Sinks.many().multicast().directBestEffort();
        
        logger.debug("ResilienceEventPublisher initialized");
    }
    
    public void publishStateChange(CircuitStateChangeEvent event) {
        emit(stateChangeSink, event, "breaker state change");
    }
    
    public void publishCallRejected(String breakerName, CircuitBreakerState state) {
        emit(rejectionSink, new CallRejectedEvent(breakerName, state, clock.instant()), "call rejection");
    }
    
    public void publishServiceStateChange(String service, ServiceState previousState, ServiceState newState,
                                          String reason) {
        emit(serviceStateSink,
            new ServiceStateChangeEvent(service, previousState, newState, reason, clock.instant()),
            "service state change");
    }
    
    public void publishLevelChange(DegradationLevel previousLevel, DegradationLevel newLevel) {
        emit(levelSink, new LevelChangeEvent(previousLevel, newLevel, clock.instant()), "level change");
    }
    
    public void publishWriteQueued(String service, String operation, int queueSize) {
        emit(writeQueuedSink, new WriteQueuedEvent(service, operation, queueSize, clock.instant()), "write queued");
    }
    
    /**
     * Publishes a connection pool event.
     *
     * @param poolName the pool name
     * @param event the pool event type
     * @param details additional event details
     */
    public void publishPoolEvent(String poolName, PoolEvent event, String details) {
        emit(poolEventSink, new PoolEventNotification(poolName, event, details, clock.instant()), "pool event");
    }
    
    public Disposable subscribeToStateChanges(Consumer<CircuitStateChangeEvent> listener) {
        return subscribe("breaker", stateChangeSink.asFlux(), listener);
    }
    
    public Disposable subscribeToRejections(Consumer<CallRejectedEvent> listener) {
        return subscribe("rejection", rejectionSink.asFlux(), listener);
    }
    
    public Disposable subscribeToServiceStateChanges(Consumer<ServiceStateChangeEvent> listener) {
        return subscribe("service", serviceStateSink.asFlux(), listener);
    }
    
    public Disposable subscribeToLevelChanges(Consumer<LevelChangeEvent> listener) {
        return subscribe("level", levelSink.asFlux(), listener);
    }
    
    public Disposable subscribeToWriteQueued(Consumer<WriteQueuedEvent> listener) {
        return subscribe("write", writeQueuedSink.asFlux(), listener);
    }
    
    public Disposable subscribeToPoolEvents(Consumer<PoolEventNotification> listener) {
        return subscribe("pool", poolEventSink.asFlux(), listener);
    }
    
    public Flux<CircuitStateChangeEvent> getStateChangeStream() {
        return stateChangeSink.asFlux();
    }
    
    public Flux<CallRejectedEvent> getRejectionStream() {
        return rejectionSink.asFlux();
    }
    
    public Flux<ServiceStateChangeEvent> getServiceStateStream() {
        return serviceStateSink.asFlux();
    }
    
    public Flux<LevelChangeEvent> getLevelChangeStream() {
        return levelSink.asFlux();
    }
    
    public Flux<WriteQueuedEvent> getWriteQueuedStream() {
        return writeQueuedSink.asFlux();
    }
    
    public Flux<PoolEventNotification> getPoolEventStream() {
        return poolEventSink.asFlux();
    }
    
    public int getSubscriberCount() {
        return subscribers.size();
    }
    
    public boolean isClosed() {
        return closed;
    }
    
    /**
     * Completes all streams. Later publications are ignored.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing ResilienceEventPublisher with {} active subscribers", subscribers.size());
        
        stateChangeSink.tryEmitComplete();
        rejectionSink.tryEmitComplete();
        serviceStateSink.tryEmitComplete();
        levelSink.tryEmitComplete();
        writeQueuedSink.tryEmitComplete();
        poolEventSink.tryEmitComplete();
        subscribers.clear();
    }
    
    private synchronized <E> void emit(Sinks.Many<E> sink, E event, String description) {
        if (closed) {
            return;
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.trace("No subscribers for {}: {}", description, event);
        } else if (result.isFailure()) {
            logger.warn("Failed to publish {} {}: {}", description, event, result);
        } else {
            logger.debug("Published {}: {}", description, event);
        }
    }
    
    private <E> Disposable subscribe(String kind, Flux<E> stream, Consumer<E> listener) {
        String subscriberId = kind + "-" + subscriberSequence.incrementAndGet();
        subscribers.put(subscriberId, Boolean.TRUE);
        logger.debug("New {} event subscriber: {} (total subscribers: {})", kind, subscriberId, subscribers.size());
        
        return stream
            .doOnCancel(() -> {
                subscribers.remove(subscriberId);
                logger.debug("Subscription cancelled: {} (remaining: {})", subscriberId, subscribers.size());
            })
            .subscribe(
                listener,
                error -> logger.error("Event subscriber {} failed", subscriberId, error),
                () -> subscribers.remove(subscriberId)
            );
    }
    
    /**
     * A call rejected by an open breaker.
     */
    public record CallRejectedEvent(String breakerName, CircuitBreakerState state, Instant timestamp) {
    }
    
    /**
     * A tracked service changed state.
     */
    public record ServiceStateChangeEvent(String service, ServiceState previousState, ServiceState newState,
                                          String reason, Instant timestamp) {
    }
    
    /**
     * The system-wide degradation level changed.
     */
    public record LevelChangeEvent(DegradationLevel previousLevel, DegradationLevel newLevel, Instant timestamp) {
    }
    
    /**
     * A write was deferred into the coordinator's queue.
     */
    public record WriteQueuedEvent(String service, String operation, int queueSize, Instant timestamp) {
    }
    
    /**
     * A connection pool event.
     */
    public record PoolEventNotification(String poolName, PoolEvent event, String details, Instant timestamp) {
        
        @Override
        public String toString() {
            return String.format("PoolEventNotification{pool='%s', event=%s, details='%s', timestamp=%s}",
                poolName, event, details, timestamp);
        }
    }
}
