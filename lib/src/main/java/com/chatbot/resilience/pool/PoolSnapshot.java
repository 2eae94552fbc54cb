package com.chatbot.resilience.pool;

import com.zaxxer.hikari.HikariPoolMXBean;

import java.time.Instant;

/**
 * One sample of a connection pool's occupancy.
 */
public record PoolSnapshot(String poolName, int total, int idle, int active, int waiting, Instant timestamp) {
    
    public static PoolSnapshot of(String poolName, HikariPoolMXBean pool, Instant timestamp) {
        return new PoolSnapshot(
            poolName,
            pool.getTotalConnections(),
            pool.getIdleConnections(),
            pool.getActiveConnections(),
            pool.getThreadsAwaitingConnection(),
            timestamp);
    }
    
    /**
     * Active connections as a fraction of total connections. An empty pool counts
     * as having one connection so the ratio stays defined.
     */
    public double utilization() {
        return (double) active / (total == 0 ? 1 : total);
    }
    
    public double getUtilizationPercentage() {
        return utilization() * 100.0;
    }
    
    @Override
    public String toString() {
        return String.format("PoolSnapshot{pool='%s', total=%d, idle=%d, active=%d, waiting=%d, utilization=%.1f%%}",
            poolName, total, idle, active, waiting, getUtilizationPercentage());
    }
}
