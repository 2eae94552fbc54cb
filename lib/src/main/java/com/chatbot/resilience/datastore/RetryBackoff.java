package com.chatbot.resilience.datastore;

import com.chatbot.resilience.config.RetryPolicyConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Exponential backoff with symmetric jitter, exposed as a Resilience4j interval function.
 * Attempt {@code k} (0-based) waits {@code base * 2^k} scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter]}, never more than the policy's max delay.
 */
public class RetryBackoff {
    
    private final RetryPolicyConfig policy;
    private final DoubleSupplier random;
    
    public RetryBackoff(RetryPolicyConfig policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }
    
    /**
     * @param random source of values in [0, 1)
     */
    RetryBackoff(RetryPolicyConfig policy, DoubleSupplier random) {
        this.policy = policy;
        this.random = random;
    }
    
    public Duration delayFor(int attempt) {
        double maxMillis = policy.getMaxDelay().toMillis();
        double exponential = Math.min(policy.getBaseDelay().toMillis() * Math.pow(2, attempt), maxMillis * 2);
        double jitter = exponential * policy.getJitterFactor() * (random.getAsDouble() * 2 - 1);
        long delay = Math.round(Math.min(exponential + jitter, maxMillis));
        return Duration.ofMillis(Math.max(delay, 0));
    }
    
    /**
     * Resilience4j numbers attempts from 1; the wait before retry {@code n} uses attempt {@code n - 1}.
     */
    public IntervalFunction intervalFunction() {
        return attempt -> delayFor(attempt - 1).toMillis();
    }
    
    /**
     * Builds a retry configuration allowing {@code maxRetries} retries after the first attempt.
     * 
     * @param maxRetries retries after the first attempt
     * @param retryOn decides which failures are retried
     */
    public RetryConfig toRetryConfig(int maxRetries, Predicate<Throwable> retryOn) {
        return RetryConfig.custom()
            .maxAttempts(maxRetries + 1)
            .intervalFunction(intervalFunction())
            .retryOnException(retryOn)
            .build();
    }
    
    public RetryPolicyConfig getPolicy() {
        return policy;
    }
}
