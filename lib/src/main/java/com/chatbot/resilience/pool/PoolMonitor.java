package com.chatbot.resilience.pool;

import com.chatbot.resilience.observability.ResilienceMetrics;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Periodically samples Hikari pools, warns on high utilization and alerts when
 * threads are waiting for a connection.
 */
public class PoolMonitor implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(PoolMonitor.class);
    
    private final double highUtilizationThreshold;
    private final ResilienceMetrics metrics;
    private final Clock clock;
    private final Map<String, Supplier<HikariPoolMXBean>> pools = new ConcurrentHashMap<>();
    private final List<PoolEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    
    public PoolMonitor(double highUtilizationThreshold, ResilienceMetrics metrics) {
        this(highUtilizationThreshold, metrics, Clock.systemUTC());
    }
    
    public PoolMonitor(double highUtilizationThreshold, ResilienceMetrics metrics, Clock clock) {
        this.highUtilizationThreshold = highUtilizationThreshold;
        this.metrics = metrics;
        this.clock = clock;
    }
    
    /**
     * Adds a pool to sample. The supplier is consulted on every sample so pools that
     * start lazily are picked up once they exist.
     * 
     * @param poolName the pool name used in logs, events and metric tags
     * @param pool supplies the pool's MXBean; may return null while the pool is not started
     */
    public void register(String poolName, Supplier<HikariPoolMXBean> pool) {
        pools.put(poolName, pool);
    }
    
    public void unregister(String poolName) {
        pools.remove(poolName);
    }
    
    public void addListener(PoolEventListener listener) {
        listeners.add(listener);
    }
    
    /**
     * Starts sampling on a daemon thread at a fixed delay. Calling it again has no effect.
     * 
     * @param interval time between samples
     */
    public void start(Duration interval) {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "db-pool-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::sampleSafely,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Pool monitor started for {} pool(s), interval {}ms", pools.size(), interval.toMillis());
    }
    
    /**
     * Samples every registered pool once and raises alerts for the results.
     * 
     * @return the samples taken
     */
    public List<PoolSnapshot> sample() {
        List<PoolSnapshot> snapshots = new ArrayList<>();
        for (Map.Entry<String, Supplier<HikariPoolMXBean>> entry : pools.entrySet()) {
            HikariPoolMXBean pool = entry.getValue().get();
            if (pool == null) {
                continue;
            }
            PoolSnapshot snapshot = PoolSnapshot.of(entry.getKey(), pool, clock.instant());
            evaluate(snapshot);
            snapshots.add(snapshot);
        }
        return snapshots;
    }
    
    void evaluate(PoolSnapshot snapshot) {
        if (metrics != null) {
            metrics.recordPoolSnapshot(snapshot);
        }
        
        if (snapshot.utilization() > highUtilizationThreshold) {
            String details = String.format("%.1f%% (%d/%d active, %d waiting)",
                snapshot.getUtilizationPercentage(), snapshot.active(), snapshot.total(), snapshot.waiting());
            logger.warn("{} pool high utilization: {}", snapshot.poolName(), details);
            notifyListeners(snapshot.poolName(), PoolEvent.HIGH_UTILIZATION_WARNING, details);
        }
        
        if (snapshot.waiting() > 0) {
            String details = String.format("%d clients waiting for connections", snapshot.waiting());
            logger.error("{} pool exhaustion: {}", snapshot.poolName(), details);
            notifyListeners(snapshot.poolName(), PoolEvent.POOL_EXHAUSTED, details);
        }
    }
    
    public void notifyListeners(String poolName, PoolEvent event, String details) {
        for (PoolEventListener listener : listeners) {
            try {
                listener.onPoolEvent(poolName, event, details);
            } catch (RuntimeException e) {
                logger.warn("Pool event listener failed for {} event on pool {}", event, poolName, e);
            }
        }
    }
    
    public boolean isRunning() {
        return started.get() && scheduler != null && !scheduler.isShutdown();
    }
    
    private void sampleSafely() {
        try {
            sample();
        } catch (Exception e) {
            logger.error("Error sampling connection pools", e);
        }
    }
    
    @Override
    public void close() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Pool monitor stopped");
    }
}
