package com.chatbot.resilience.pool;

import com.chatbot.resilience.config.DatabaseConfig;
import com.chatbot.resilience.config.DatabaseEndpoint;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HikariDataSourceFactoryTest {
    
    @Test
    void testReplicaPoolSettings() {
        DatabaseEndpoint endpoint = DatabaseEndpoint.builder()
            .host("replica.db")
            .port(5433)
            .user("reader")
            .password("secret")
            .database("chatbot")
            .minPoolSize(2)
            .maxPoolSize(20)
            .readOnly(true)
            .build();
        DatabaseConfig config = DatabaseConfig.builder()
            .idleTimeout(Duration.ofSeconds(30))
            .connectionTimeout(Duration.ofSeconds(10))
            .build();
        
        HikariConfig hikari = HikariDataSourceFactory.toHikariConfig("replica", endpoint, config);
        
        assertEquals("chatbot-replica", hikari.getPoolName());
        assertEquals(endpoint.getJdbcUrl(), hikari.getJdbcUrl());
        assertEquals("reader", hikari.getUsername());
        assertEquals(2, hikari.getMinimumIdle());
        assertEquals(20, hikari.getMaximumPoolSize());
        assertEquals(30_000L, hikari.getIdleTimeout());
        assertEquals(10_000L, hikari.getConnectionTimeout());
        assertTrue(hikari.isReadOnly());
        assertEquals(-1L, hikari.getInitializationFailTimeout());
    }
}
