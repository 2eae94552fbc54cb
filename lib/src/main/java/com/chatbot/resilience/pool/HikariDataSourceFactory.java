package com.chatbot.resilience.pool;

import com.chatbot.resilience.config.DatabaseConfig;
import com.chatbot.resilience.config.DatabaseEndpoint;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates Hikari connection pools for PostgreSQL endpoints.
 */
public final class HikariDataSourceFactory {
    
    private HikariDataSourceFactory() {
    }
    
    public static HikariConfig toHikariConfig(String poolName, DatabaseEndpoint endpoint, DatabaseConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("chatbot-" + poolName);
        hikari.setJdbcUrl(endpoint.getJdbcUrl());
        hikari.setUsername(endpoint.getUser());
        hikari.setPassword(endpoint.getPassword());
        hikari.setMinimumIdle(endpoint.getMinPoolSize());
        hikari.setMaximumPoolSize(endpoint.getMaxPoolSize());
        hikari.setIdleTimeout(config.getIdleTimeout().toMillis());
        hikari.setConnectionTimeout(config.getConnectionTimeout().toMillis());
        hikari.setReadOnly(endpoint.isReadOnly());
        // start without a live server; the store probes the pool itself
        hikari.setInitializationFailTimeout(-1);
        hikari.addDataSourceProperty("options", "-c statement_timeout=" + config.getQueryTimeout().toMillis());
        hikari.addDataSourceProperty("ApplicationName", "chatbot-" + poolName);
        return hikari;
    }
    
    public static HikariDataSource create(String poolName, DatabaseEndpoint endpoint, DatabaseConfig config) {
        return new HikariDataSource(toHikariConfig(poolName, endpoint, config));
    }
}
