package com.chatbot.resilience.degradation;

import com.chatbot.resilience.config.DegradationConfig;
import com.chatbot.resilience.model.DegradationHealth;
import com.chatbot.resilience.model.DegradationLevel;
import com.chatbot.resilience.model.QueuedWrite;
import com.chatbot.resilience.model.ServiceInfo;
import com.chatbot.resilience.model.ServiceState;
import com.chatbot.resilience.model.SystemStatus;
import com.chatbot.resilience.observability.ResilienceEventPublisher;
import com.chatbot.resilience.observability.ResilienceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Tracks per-service health, derives the system degradation level, runs fallback
 * chains and defers writes until their service recovers.
 * <p>
 * {@link #execute} never completes exceptionally; callers branch on
 * {@link DegradedResult#isSuccess()}. The only recovery signal is a successful call
 * or an explicit {@link #markHealthy}; nothing polls.
 */
public class DegradationCoordinator implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(DegradationCoordinator.class);
    
    public static final String REDIS = "redis";
    public static final String DATABASE = "database";
    public static final String LAVALINK = "lavalink";
    public static final String DISCORD = "discord";
    
    private final DegradationConfig config;
    private final ResilienceEventPublisher eventPublisher;
    private final ResilienceMetrics metrics;
    private final Clock clock;
    private final Executor replayExecutor;
    private final ExecutorService ownedExecutor;
    
    // guarded by this
    private final Map<String, TrackedService> services = new LinkedHashMap<>();
    private final LinkedList<QueuedWrite> writeQueue = new LinkedList<>();
    private DegradationLevel level = DegradationLevel.NORMAL;
    private boolean initialized;
    
    private final Map<String, FallbackHandler> fallbackHandlers = new ConcurrentHashMap<>();
    private final Map<String, QueuedWriteProcessor> writeProcessors = new ConcurrentHashMap<>();
    private final Set<String> replaying = ConcurrentHashMap.newKeySet();
    private final FallbackCache fallbackCache;
    private final AtomicLong writeSequence = new AtomicLong();
    
    public DegradationCoordinator() {
        this(DegradationConfig.defaultConfig(), null, null, Clock.systemUTC());
    }
    
    /**
     * Creates a coordinator that replays queued writes on its own daemon thread.
     */
    public DegradationCoordinator(DegradationConfig config, ResilienceEventPublisher eventPublisher,
                                  ResilienceMetrics metrics, Clock clock) {
        this(config, eventPublisher, metrics, clock, null);
    }
    
    /**
     * @param replayExecutor runs queued-write replays; null to use an owned daemon thread
     */
    public DegradationCoordinator(DegradationConfig config, ResilienceEventPublisher eventPublisher,
                                  ResilienceMetrics metrics, Clock clock, Executor replayExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fallbackCache = new FallbackCache(config.getMaxCacheSize());
        if (replayExecutor != null) {
            this.replayExecutor = replayExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "degradation-write-replay");
                t.setDaemon(true);
                return t;
            });
            this.replayExecutor = ownedExecutor;
        }
    }
    
    /**
     * Registers the core services. Idempotent.
     */
    public void initialize() {
        synchronized (this) {
            if (initialized) {
                return;
            }
            initialized = true;
        }
        registerService(REDIS, false);
        registerService(DATABASE, true);
        registerService(LAVALINK, false);
        registerService(DISCORD, true);
        logger.info("Degradation coordinator initialized");
    }
    
    /**
     * Starts tracking a service as HEALTHY. Re-registering a name replaces its state.
     *
     * @param name the service name
     * @param critical whether the service being unavailable makes the system CRITICAL
     */
    public void registerService(String name, boolean critical) {
        LevelChange levelChange;
        synchronized (this) {
            TrackedService previous = services.put(name, new TrackedService(name, critical, clock.instant()));
            if (previous != null) {
                logger.debug("Service '{}' re-registered", name);
            }
            levelChange = recomputeLevel();
        }
        publishLevelChange(levelChange);
    }
    
    public void registerFallback(String service, FallbackHandler handler) {
        fallbackHandlers.put(service, Objects.requireNonNull(handler, "handler"));
    }
    
    public void registerWriteProcessor(String service, QueuedWriteProcessor processor) {
        writeProcessors.put(service, Objects.requireNonNull(processor, "processor"));
    }
    
    /**
     * Sets a service's state and recomputes the system level. Unknown services are ignored.
     * Notifications fire only when the state or level actually changes.
     *
     * @param name the service name
     * @param newState the new state
     * @param reason why the state changed, may be empty
     */
    public void markService(String name, ServiceState newState, String reason) {
        ServiceState previousState;
        LevelChange levelChange;
        synchronized (this) {
            TrackedService service = services.get(name);
            if (service == null) {
                return;
            }
            Instant now = clock.instant();
            previousState = service.state;
            service.state = newState;
            service.failureCount++;
            if (newState != ServiceState.HEALTHY && service.degradedSince == null) {
                service.degradedSince = now;
            } else if (newState == ServiceState.HEALTHY) {
                service.lastHealthy = now;
                service.degradedSince = null;
                service.failureCount = 0;
            }
            levelChange = recomputeLevel();
        }
        
        if (previousState != newState) {
            if (reason != null && !reason.isEmpty()) {
                logger.info("{}: {} -> {} ({})", name, previousState, newState, reason);
            } else {
                logger.info("{}: {} -> {}", name, previousState, newState);
            }
            if (eventPublisher != null) {
                eventPublisher.publishServiceStateChange(name, previousState, newState, reason);
            }
            if (metrics != null) {
                metrics.recordServiceStateChange(name, newState);
            }
        }
        publishLevelChange(levelChange);
    }
    
    /**
     * Marks a service healthy and replays its queued writes.
     */
    public void markHealthy(String name) {
        markService(name, ServiceState.HEALTHY, "");
        replayQueuedWrites(name);
    }
    
    public void markDegraded(String name, String reason) {
        markService(name, ServiceState.DEGRADED, reason);
    }
    
    public void markUnavailable(String name, String reason) {
        markService(name, ServiceState.UNAVAILABLE, reason);
    }
    
    /**
     * Runs an operation with graceful degradation.
     * <p>
     * If the service is UNAVAILABLE the operation is skipped. Otherwise a success caches
     * the result (when a cache key is given) and marks the service healthy; a failure marks
     * it DEGRADED. Failed or skipped calls then try, in order: the per-call fallback, the
     * service's registered handler, the last cached value, the static fallback value.
     *
     * @param service the service name
     * @param operation supplies the primary call
     * @param options fallback options, may be null
     * @return a future that always completes normally
     */
    public <T> CompletableFuture<DegradedResult<T>> execute(String service,
                                                            Supplier<? extends CompletionStage<T>> operation,
                                                            ExecuteOptions<T> options) {
        ExecuteOptions<T> opts = options != null ? options : ExecuteOptions.none();
        
        if (getServiceState(service).orElse(null) == ServiceState.UNAVAILABLE) {
            logger.debug("Service '{}' unavailable, skipping straight to fallback", service);
            return CompletableFuture.completedFuture(safely(() -> executeFallback(service, opts, null)));
        }
        
        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(operation.get(), "operation returned null");
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(safely(() -> onFailure(service, opts, e)));
        }
        
        CompletableFuture<DegradedResult<T>> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(safely(() -> onSuccess(service, opts, value)));
            } else {
                result.complete(safely(() -> onFailure(service, opts, unwrap(error))));
            }
        });
        return result;
    }
    
    public <T> CompletableFuture<DegradedResult<T>> execute(String service,
                                                            Supplier<? extends CompletionStage<T>> operation) {
        return execute(service, operation, ExecuteOptions.none());
    }
    
    /**
     * Appends a write to the bounded queue, dropping the oldest entry when it is full.
     *
     * @return the queued entry
     */
    public QueuedWrite queueWrite(String service, String operation, Object payload, Map<String, Object> options) {
        QueuedWrite write = new QueuedWrite(writeSequence.incrementAndGet(), service, operation, payload,
            options, clock.instant(), 0);
        QueuedWrite dropped = null;
        int size;
        synchronized (this) {
            if (writeQueue.size() >= config.getMaxQueueSize()) {
                dropped = writeQueue.removeFirst();
            }
            writeQueue.addLast(write);
            size = writeQueue.size();
        }
        
        if (dropped != null) {
            logger.warn("Write queue full, dropping oldest entry ({} {} for {})",
                dropped.operation(), dropped.id(), dropped.service());
            if (metrics != null) {
                metrics.recordDroppedWrite();
            }
        }
        if (metrics != null) {
            metrics.recordQueueSize(size);
        }
        if (eventPublisher != null) {
            eventPublisher.publishWriteQueued(service, operation, size);
        }
        return write;
    }
    
    public QueuedWrite queueWrite(String service, String operation, Object payload) {
        return queueWrite(service, operation, payload, Map.of());
    }
    
    public synchronized boolean isAvailable(String service) {
        TrackedService tracked = services.get(service);
        return tracked != null && tracked.state == ServiceState.HEALTHY;
    }
    
    public synchronized boolean isDegraded(String service) {
        TrackedService tracked = services.get(service);
        return tracked != null && tracked.state == ServiceState.DEGRADED;
    }
    
    public synchronized Optional<ServiceState> getServiceState(String service) {
        TrackedService tracked = services.get(service);
        return tracked != null ? Optional.of(tracked.state) : Optional.empty();
    }
    
    public synchronized Optional<ServiceInfo> getServiceInfo(String service) {
        TrackedService tracked = services.get(service);
        return tracked != null ? Optional.of(tracked.snapshot()) : Optional.empty();
    }
    
    public synchronized DegradationLevel getLevel() {
        return level;
    }
    
    public synchronized boolean isSystemDegraded() {
        return level != DegradationLevel.NORMAL;
    }
    
    public synchronized int getQueueSize() {
        return writeQueue.size();
    }
    
    public synchronized List<QueuedWrite> getQueuedWrites() {
        return List.copyOf(writeQueue);
    }
    
    public synchronized SystemStatus getStatus() {
        Map<String, ServiceInfo> snapshot = new LinkedHashMap<>();
        services.forEach((name, service) -> snapshot.put(name, service.snapshot()));
        return new SystemStatus(level, clock.instant(), snapshot, writeQueue.size(), fallbackCache.size());
    }
    
    public DegradationHealth getHealth() {
        SystemStatus status = getStatus();
        return new DegradationHealth(status.isHealthy(), status);
    }
    
    public void clearCache() {
        fallbackCache.clear();
    }
    
    public void clearCache(String service) {
        fallbackCache.clearService(service);
    }
    
    /**
     * Forgets all services, handlers, cached values and queued writes.
     * The coordinator can be initialized again afterwards.
     */
    public void shutdown() {
        synchronized (this) {
            services.clear();
            writeQueue.clear();
            level = DegradationLevel.NORMAL;
            initialized = false;
        }
        fallbackHandlers.clear();
        writeProcessors.clear();
        fallbackCache.clear();
        if (metrics != null) {
            metrics.recordQueueSize(0);
            metrics.recordLevel(DegradationLevel.NORMAL);
        }
        logger.info("Degradation coordinator shut down");
    }
    
    /**
     * Shuts down and stops the replay thread if the coordinator owns one.
     */
    @Override
    public void close() {
        shutdown();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
    
    private <T> DegradedResult<T> onSuccess(String service, ExecuteOptions<T> options, T value) {
        if (value != null) {
            options.getCacheKey().ifPresent(key ->
                fallbackCache.put(FallbackCache.key(service, key), value, clock.instant()));
        }
        if (!isAvailable(service)) {
            markHealthy(service);
        }
        return DegradedResult.success(value);
    }
    
    private <T> DegradedResult<T> onFailure(String service, ExecuteOptions<T> options, Throwable error) {
        markDegraded(service, error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        return executeFallback(service, options, error);
    }
    
    private <T> DegradedResult<T> executeFallback(String service, ExecuteOptions<T> options, Throwable error) {
        Optional<Function<Throwable, ? extends T>> fallback = options.getFallback();
        if (fallback.isPresent()) {
            try {
                T value = fallback.get().apply(error);
                recordFallback(service, "call");
                return DegradedResult.fallback(value);
            } catch (RuntimeException e) {
                logger.debug("Fallback for '{}' failed: {}", service, e.getMessage());
            }
        }
        
        FallbackHandler handler = fallbackHandlers.get(service);
        if (handler != null) {
            try {
                T value = fallbackResult(handler.handle(error, options));
                recordFallback(service, "handler");
                return DegradedResult.fallback(value);
            } catch (Exception e) {
                logger.debug("Registered fallback handler for '{}' failed: {}", service, e.getMessage());
            }
        }
        
        Optional<String> cacheKey = options.getCacheKey();
        if (cacheKey.isPresent()) {
            Optional<FallbackCache.Entry> cached = fallbackCache.get(FallbackCache.key(service, cacheKey.get()));
            if (cached.isPresent()) {
                Duration age = Duration.between(cached.get().storedAt(), clock.instant());
                recordFallback(service, "cache");
                return DegradedResult.stale(DegradationCoordinator.<T>fallbackResult(cached.get().value()), age);
            }
        }
        
        if (options.hasFallbackValue()) {
            recordFallback(service, "value");
            return DegradedResult.fallback(options.getFallbackValue());
        }
        
        return DegradedResult.failure(error);
    }
    
    /**
     * Handlers and the cache hold untyped values; callers register them for the matching call type.
     */
    @SuppressWarnings("unchecked")
    private static <T> T fallbackResult(Object value) {
        return (T) value;
    }
    
    private void recordFallback(String service, String source) {
        if (metrics != null) {
            metrics.recordFallback(service, source);
        }
    }
    
    private <T> DegradedResult<T> safely(Supplier<DegradedResult<T>> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            logger.error("Unexpected error while coordinating call", e);
            return DegradedResult.failure(e);
        }
    }
    
    private void replayQueuedWrites(String service) {
        QueuedWriteProcessor processor = writeProcessors.get(service);
        if (processor == null) {
            if (hasQueuedWrites(service)) {
                logger.debug("No write processor for '{}', queued writes stay queued", service);
            }
            return;
        }
        if (!hasQueuedWrites(service) || !replaying.add(service)) {
            return;
        }
        try {
            replayExecutor.execute(() -> {
                try {
                    processQueue(service, processor);
                } finally {
                    replaying.remove(service);
                }
            });
        } catch (RuntimeException e) {
            replaying.remove(service);
            logger.error("Could not schedule replay of queued writes for '{}'", service, e);
        }
    }
    
    private synchronized boolean hasQueuedWrites(String service) {
        return writeQueue.stream().anyMatch(write -> write.service().equals(service));
    }
    
    void processQueue(String service, QueuedWriteProcessor processor) {
        List<QueuedWrite> pending;
        synchronized (this) {
            pending = new ArrayList<>();
            for (QueuedWrite write : writeQueue) {
                if (write.service().equals(service)) {
                    pending.add(write);
                }
            }
        }
        if (pending.isEmpty()) {
            return;
        }
        
        logger.info("Processing {} queued writes for {}", pending.size(), service);
        for (QueuedWrite write : pending) {
            try {
                processor.process(write);
                remove(write.id());
            } catch (Exception e) {
                QueuedWrite retried = write.incrementRetries();
                if (retried.retryCount() >= config.getMaxReplayAttempts()) {
                    remove(write.id());
                    logger.error("Failed to process queued write after {} retries: {} {} ({})",
                        retried.retryCount(), write.operation(), write.id(), e.getMessage());
                    if (metrics != null) {
                        metrics.recordDroppedWrite();
                    }
                } else {
                    replace(retried);
                    logger.warn("Replay of queued {} {} for {} failed (attempt {}): {}",
                        write.operation(), write.id(), service, retried.retryCount(), e.getMessage());
                }
            }
        }
        
        if (metrics != null) {
            metrics.recordQueueSize(getQueueSize());
        }
    }
    
    private synchronized void remove(long id) {
        writeQueue.removeIf(write -> write.id() == id);
    }
    
    private synchronized void replace(QueuedWrite updated) {
        ListIterator<QueuedWrite> it = writeQueue.listIterator();
        while (it.hasNext()) {
            if (it.next().id() == updated.id()) {
                it.set(updated);
                return;
            }
        }
    }
    
    // caller holds the monitor
    private LevelChange recomputeLevel() {
        DegradationLevel previous = level;
        level = computeLevel();
        return previous != level ? new LevelChange(previous, level) : null;
    }
    
    private DegradationLevel computeLevel() {
        if (services.isEmpty()) {
            return DegradationLevel.NORMAL;
        }
        
        boolean allDown = true;
        boolean criticalDown = false;
        boolean anyDegraded = false;
        for (TrackedService service : services.values()) {
            if (service.state == ServiceState.HEALTHY) {
                allDown = false;
            } else {
                anyDegraded = true;
                if (service.state == ServiceState.UNAVAILABLE && service.critical) {
                    criticalDown = true;
                }
            }
        }
        
        if (allDown) {
            return DegradationLevel.OFFLINE;
        } else if (criticalDown) {
            return DegradationLevel.CRITICAL;
        } else if (anyDegraded) {
            return DegradationLevel.DEGRADED;
        }
        return DegradationLevel.NORMAL;
    }
    
    private void publishLevelChange(LevelChange change) {
        if (change == null) {
            return;
        }
        logger.info("System level: {} -> {}", change.previous(), change.current());
        if (eventPublisher != null) {
            eventPublisher.publishLevelChange(change.previous(), change.current());
        }
        if (metrics != null) {
            metrics.recordLevel(change.current());
        }
    }
    
    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
    
    private record LevelChange(DegradationLevel previous, DegradationLevel current) {
    }
    
    private static final class TrackedService {
        private final String name;
        private final boolean critical;
        private ServiceState state = ServiceState.HEALTHY;
        private Instant lastHealthy;
        private Instant degradedSince;
        private int failureCount;
        
        TrackedService(String name, boolean critical, Instant registeredAt) {
            this.name = name;
            this.critical = critical;
            this.lastHealthy = registeredAt;
        }
        
        ServiceInfo snapshot() {
            return new ServiceInfo(name, state, critical, lastHealthy, degradedSince, failureCount);
        }
    }
}
