package com.chatbot.resilience.datastore;

import com.chatbot.resilience.config.RetryPolicyConfig;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {
    
    private final RetryPolicyConfig policy = RetryPolicyConfig.builder()
        .baseDelay(Duration.ofSeconds(1))
        .maxDelay(Duration.ofSeconds(10))
        .jitterFactor(0.25)
        .build();
    
    @Test
    void testDelayStaysWithinJitterBounds() {
        RetryBackoff backoff = new RetryBackoff(policy);
        for (int attempt = 0; attempt < 3; attempt++) {
            long expected = 1000L << attempt;
            for (int i = 0; i < 50; i++) {
                long delay = backoff.delayFor(attempt).toMillis();
                assertTrue(delay >= expected * 0.75 && delay <= expected * 1.25,
                    "attempt " + attempt + " delay " + delay);
            }
        }
    }
    
    @Test
    void testJitterExtremes() {
        assertEquals(Duration.ofMillis(1500), new RetryBackoff(policy, () -> 0.0).delayFor(1));
        assertEquals(Duration.ofMillis(2000), new RetryBackoff(policy, () -> 0.5).delayFor(1));
    }
    
    @Test
    void testDelayIsCappedAtMax() {
        RetryBackoff backoff = new RetryBackoff(policy, () -> 0.99);
        assertEquals(Duration.ofSeconds(10), backoff.delayFor(4));
        assertEquals(Duration.ofSeconds(10), backoff.delayFor(40));
    }
    
    @Test
    void testIntervalFunctionIsOneBased() {
        RetryBackoff backoff = new RetryBackoff(policy, () -> 0.5);
        assertEquals(1000L, backoff.intervalFunction().apply(1).longValue());
        assertEquals(4000L, backoff.intervalFunction().apply(3).longValue());
    }
    
    @Test
    void testRetryConfigAllowsRetriesAfterFirstAttempt() {
        RetryConfig config = new RetryBackoff(policy).toRetryConfig(3, TransientErrorClassifier::isTransient);
        
        assertEquals(4, config.getMaxAttempts());
        assertTrue(config.getExceptionPredicate().test(new SQLException("deadlock", "40P01")));
        assertFalse(config.getExceptionPredicate().test(new SQLException("syntax", "42601")));
    }
}
