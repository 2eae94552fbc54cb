package com.chatbot.resilience.breaker;

import com.chatbot.resilience.config.CircuitBreakerConfig;
import com.chatbot.resilience.model.CircuitBreakerMetrics;
import com.chatbot.resilience.model.CircuitBreakerState;
import com.chatbot.resilience.model.CircuitHealth;
import com.chatbot.resilience.model.HealthStatus;
import com.chatbot.resilience.model.StateChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding one asynchronous dependency.
 * <p>
 * CLOSED trips to OPEN after {@code failureThreshold} consecutive failures. OPEN moves to
 * HALF_OPEN lazily: only a call arriving after the reset deadline triggers it, there is no
 * background timer. HALF_OPEN closes after {@code successThreshold} consecutive successes
 * and reopens on a single failure.
 * <p>
 * State transitions are guarded by the breaker's monitor; request counters are atomic.
 */
public class CircuitBreaker {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);
    
    static final int MAX_STATE_CHANGES = 20;
    
    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();
    
    // guarded by this
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant nextAttempt;
    private final Deque<StateChange> stateChanges = new ArrayDeque<>();
    
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong rejectedRequests = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong fallbackExecutions = new AtomicLong();
    
    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }
    
    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }
    
    /**
     * Executes an asynchronous operation under breaker protection, using the configured
     * fallback (if any) on failure or rejection.
     *
     * @param operation supplies the call to protect
     * @return a future completing with the call's result or the fallback's outcome
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation) {
        return execute(operation, null);
    }
    
    /**
     * Executes an asynchronous operation under breaker protection.
     * The per-call fallback takes precedence over the configured one.
     *
     * @param operation supplies the call to protect
     * @param fallback per-call fallback, or null
     * @return a future completing with the call's result or the fallback's outcome
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation,
                                            Function<Throwable, ? extends T> fallback) {
        if (!config.isEnabled()) {
            return invoke(operation);
        }
        
        totalRequests.incrementAndGet();
        
        CircuitStateChangeEvent transition = null;
        boolean rejected = false;
        synchronized (this) {
            if (state == CircuitBreakerState.OPEN) {
                if (nextAttempt == null || !clock.instant().isBefore(nextAttempt)) {
                    transition = transitionTo(CircuitBreakerState.HALF_OPEN);
                } else {
                    rejected = true;
                }
            }
        }
        fireStateChange(transition);
        
        if (rejected) {
            return handleRejection(fallback);
        }
        
        return invoke(operation)
            .orTimeout(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .handle((result, error) -> {
                if (error == null) {
                    onSuccess();
                    return CompletableFuture.completedFuture(result);
                }
                return this.<T>onFailure(classify(error), fallback);
            })
            .thenCompose(Function.identity());
    }
    
    /**
     * Forces the breaker open. No-op if it is already open.
     */
    public void trip() {
        CircuitStateChangeEvent transition;
        synchronized (this) {
            transition = transitionTo(CircuitBreakerState.OPEN);
        }
        fireStateChange(transition);
    }
    
    /**
     * Forces the breaker closed and clears the failure and success counts.
     */
    public void reset() {
        CircuitStateChangeEvent transition;
        synchronized (this) {
            transition = transitionTo(CircuitBreakerState.CLOSED);
            failureCount = 0;
            successCount = 0;
        }
        fireStateChange(transition);
    }
    
    public synchronized CircuitBreakerState getState() {
        return state;
    }
    
    public boolean isOpen() {
        return getState() == CircuitBreakerState.OPEN;
    }
    
    public boolean isClosed() {
        return getState() == CircuitBreakerState.CLOSED;
    }
    
    public String getName() {
        return name;
    }
    
    public CircuitBreakerConfig getConfig() {
        return config;
    }
    
    public void addListener(CircuitBreakerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }
    
    public void removeListener(CircuitBreakerListener listener) {
        listeners.remove(listener);
    }
    
    public synchronized CircuitBreakerMetrics getMetrics() {
        return CircuitBreakerMetrics.builder()
            .name(name)
            .state(state)
            .failureCount(failureCount)
            .successCount(successCount)
            .lastFailureTime(lastFailureTime)
            .nextAttempt(nextAttempt)
            .totalRequests(totalRequests.get())
            .successfulRequests(successfulRequests.get())
            .failedRequests(failedRequests.get())
            .rejectedRequests(rejectedRequests.get())
            .timeouts(timeouts.get())
            .fallbackExecutions(fallbackExecutions.get())
            .stateChanges(new ArrayList<>(stateChanges))
            .build();
    }
    
    /**
     * Zeroes request counters and clears the state-change history. The current state
     * and failure/success counts are left alone.
     */
    public synchronized void resetMetrics() {
        totalRequests.set(0);
        successfulRequests.set(0);
        failedRequests.set(0);
        rejectedRequests.set(0);
        timeouts.set(0);
        fallbackExecutions.set(0);
        stateChanges.clear();
    }
    
    public synchronized CircuitHealth getHealth() {
        return new CircuitHealth(name, HealthStatus.fromState(state), state, failureCount, lastFailureTime, nextAttempt);
    }
    
    static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> operation) {
        CompletableFuture<T> guard = new CompletableFuture<>();
        try {
            CompletionStage<T> stage = Objects.requireNonNull(operation.get(), "operation returned null");
            stage.whenComplete((value, error) -> {
                if (error != null) {
                    guard.completeExceptionally(new CompletionException(unwrap(error)));
                } else {
                    guard.complete(value);
                }
            });
        } catch (RuntimeException e) {
            guard.completeExceptionally(new CompletionException(e));
        }
        return guard;
    }
    
    private Throwable classify(Throwable error) {
        // orTimeout stores a bare TimeoutException; errors of the call itself arrive wrapped
        if (error instanceof TimeoutException) {
            timeouts.incrementAndGet();
            return new CircuitBreakerException.CallTimeoutException(name, config.getTimeout());
        }
        return unwrap(error);
    }
    
    private void onSuccess() {
        successfulRequests.incrementAndGet();
        
        CircuitStateChangeEvent transition = null;
        synchronized (this) {
            if (state == CircuitBreakerState.HALF_OPEN) {
                successCount++;
                if (successCount >= config.getSuccessThreshold()) {
                    transition = transitionTo(CircuitBreakerState.CLOSED);
                    failureCount = 0;
                    successCount = 0;
                }
            } else {
                failureCount = 0;
            }
        }
        fireStateChange(transition);
    }
    
    private <T> CompletableFuture<T> onFailure(Throwable error, Function<Throwable, ? extends T> fallback) {
        failedRequests.incrementAndGet();
        
        if (!isCircuitFailure(error)) {
            logger.debug("Circuit breaker '{}' ignoring non-failure error: {}", name, error.toString());
            return CompletableFuture.failedFuture(error);
        }
        
        CircuitStateChangeEvent transition = null;
        synchronized (this) {
            lastFailureTime = clock.instant();
            failureCount++;
            if (state == CircuitBreakerState.HALF_OPEN) {
                transition = transitionTo(CircuitBreakerState.OPEN);
                successCount = 0;
            } else if (state == CircuitBreakerState.CLOSED && failureCount >= config.getFailureThreshold()) {
                transition = transitionTo(CircuitBreakerState.OPEN);
            }
        }
        fireStateChange(transition);
        
        return applyFallback(error, fallback);
    }
    
    private boolean isCircuitFailure(Throwable error) {
        try {
            return config.getIsFailure().test(error);
        } catch (RuntimeException e) {
            logger.warn("isFailure predicate of circuit breaker '{}' threw, counting as failure", name, e);
            return true;
        }
    }
    
    private <T> CompletableFuture<T> handleRejection(Function<Throwable, ? extends T> fallback) {
        rejectedRequests.incrementAndGet();
        logger.debug("Circuit breaker '{}' rejected call", name);
        
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onCallRejected(name, CircuitBreakerState.OPEN);
            } catch (RuntimeException e) {
                logger.warn("Rejection listener failed for circuit breaker '{}'", name, e);
            }
        }
        
        return applyFallback(new CircuitBreakerException.CircuitOpenException(name, CircuitBreakerState.OPEN), fallback);
    }
    
    private <T> CompletableFuture<T> applyFallback(Throwable error, Function<Throwable, ? extends T> fallback) {
        if (fallback == null && !config.hasFallback()) {
            return CompletableFuture.failedFuture(error);
        }
        
        fallbackExecutions.incrementAndGet();
        try {
            T value = fallback != null
                ? fallback.apply(error)
                : CircuitBreaker.<T>fallbackResult(config.getFallback().apply(error));
            return CompletableFuture.completedFuture(value);
        } catch (RuntimeException fallbackError) {
            return CompletableFuture.failedFuture(fallbackError);
        }
    }
    
    /**
     * The configured fallback serves every call type, so its result is typed per call.
     */
    @SuppressWarnings("unchecked")
    private static <T> T fallbackResult(Object value) {
        return (T) value;
    }
    
    // caller holds the monitor; returns null when the state does not change
    private CircuitStateChangeEvent transitionTo(CircuitBreakerState newState) {
        if (state == newState) {
            return null;
        }
        
        CircuitBreakerState oldState = state;
        Instant now = clock.instant();
        state = newState;
        nextAttempt = newState == CircuitBreakerState.OPEN ? now.plus(config.getResetTimeout()) : null;
        
        stateChanges.addLast(new StateChange(oldState, newState, now));
        while (stateChanges.size() > MAX_STATE_CHANGES) {
            stateChanges.removeFirst();
        }
        
        logger.debug("Circuit breaker '{}' state changed: {} -> {}", name, oldState, newState);
        return new CircuitStateChangeEvent(name, oldState, newState, now);
    }
    
    private void fireStateChange(CircuitStateChangeEvent event) {
        if (event == null) {
            return;
        }
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateChange(event);
            } catch (RuntimeException e) {
                logger.warn("State change listener failed for circuit breaker '{}'", name, e);
            }
        }
    }
    
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreaker{name='%s', state=%s}", name, getState());
    }
}
