package com.chatbot.resilience.config;

import com.chatbot.resilience.breaker.HttpStatusException;
import com.chatbot.resilience.breaker.ServiceUnavailableException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Pre-tuned breaker policies for the dependencies the bot talks to.
 * Thresholds and timeouts follow each dependency's expected latency and failure shape.
 */
public final class BreakerPolicies {
    
    public static final String LAVALINK = "lavalink";
    public static final String EXTERNAL_API = "externalApi";
    public static final String DATABASE = "database";
    public static final String REDIS = "redis";
    public static final String DISCORD = "discord";
    public static final String ANIME = "anime";
    public static final String NSFW = "nsfw";
    public static final String GOOGLE = "google";
    public static final String WIKIPEDIA = "wikipedia";
    public static final String PIXIV = "pixiv";
    public static final String FANDOM = "fandom";
    public static final String STEAM = "steam";
    
    static final int TOO_MANY_REQUESTS = 429;
    
    private BreakerPolicies() {
    }
    
    /**
     * Music streaming node. Searches can be slow, so the timeout and reset window are long.
     */
    public static CircuitBreakerConfig lavalink() {
        return policy(5, 2, 30, 60)
            .fallback(unavailable("LAVALINK_UNAVAILABLE", "Music service temporarily unavailable"))
            .build();
    }
    
    /**
     * Generic external HTTP APIs.
     */
    public static CircuitBreakerConfig externalApi() {
        return policy(3, 2, 10, 30)
            .fallback(unavailable("API_UNAVAILABLE", "External service temporarily unavailable"))
            .build();
    }
    
    public static CircuitBreakerConfig database() {
        return policy(3, 2, 5, 30)
            .fallback(unavailable("DB_UNAVAILABLE", "Database temporarily unavailable"))
            .build();
    }
    
    /**
     * Cache store. The fallback yields null because a cache miss is acceptable.
     */
    public static CircuitBreakerConfig redis() {
        return policy(5, 3, 3, 15)
            .fallback(error -> null)
            .build();
    }
    
    /**
     * Chat-platform API. Rate-limit responses (HTTP 429) never count as failures and
     * there is no fallback, so errors reach the caller.
     */
    public static CircuitBreakerConfig discord() {
        return policy(10, 3, 15, 30)
            .isFailure(error -> !isRateLimited(error))
            .build();
    }
    
    public static CircuitBreakerConfig anime() {
        return policy(3, 2, 10, 30)
            .fallback(unavailable("ANIME_API_UNAVAILABLE", "Anime service temporarily unavailable"))
            .build();
    }
    
    public static CircuitBreakerConfig nsfw() {
        return policy(3, 2, 15, 60)
            .fallback(unavailable("NSFW_API_UNAVAILABLE", "Service temporarily unavailable"))
            .build();
    }
    
    public static CircuitBreakerConfig google() {
        return policy(3, 2, 10, 30)
            .fallback(unavailable("SEARCH_API_UNAVAILABLE", "Search service temporarily unavailable"))
            .build();
    }
    
    public static CircuitBreakerConfig wikipedia() {
        return policy(3, 2, 8, 30)
            .fallback(unavailable("WIKIPEDIA_API_UNAVAILABLE", "Wikipedia service temporarily unavailable"))
            .build();
    }
    
    public static CircuitBreakerConfig pixiv() {
        return policy(3, 2, 15, 60)
            .fallback(unavailable("PIXIV_API_UNAVAILABLE", "Pixiv service temporarily unavailable"))
            .build();
    }
    
    public static CircuitBreakerConfig fandom() {
        return policy(3, 2, 10, 30)
            .fallback(unavailable("FANDOM_API_UNAVAILABLE", "Fandom service temporarily unavailable"))
            .build();
    }
    
    public static CircuitBreakerConfig steam() {
        return policy(3, 2, 10, 30)
            .fallback(unavailable("STEAM_API_UNAVAILABLE", "Steam service temporarily unavailable"))
            .build();
    }
    
    /**
     * All pre-tuned policies keyed by breaker name, in registration order.
     * 
     * @return an unmodifiable map of policies
     */
    public static Map<String, CircuitBreakerConfig> all() {
        Map<String, CircuitBreakerConfig> policies = new LinkedHashMap<>();
        policies.put(LAVALINK, lavalink());
        policies.put(EXTERNAL_API, externalApi());
        policies.put(DATABASE, database());
        policies.put(REDIS, redis());
        policies.put(DISCORD, discord());
        policies.put(ANIME, anime());
        policies.put(NSFW, nsfw());
        policies.put(GOOGLE, google());
        policies.put(WIKIPEDIA, wikipedia());
        policies.put(PIXIV, pixiv());
        policies.put(FANDOM, fandom());
        policies.put(STEAM, steam());
        return Collections.unmodifiableMap(policies);
    }
    
    /**
     * Checks whether an error, or any of its causes, is an HTTP 429 response.
     */
    public static boolean isRateLimited(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HttpStatusException
                    && ((HttpStatusException) current).getStatusCode() == TOO_MANY_REQUESTS) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
    
    private static CircuitBreakerConfig.Builder policy(int failureThreshold, int successThreshold,
                                                       long timeoutSeconds, long resetTimeoutSeconds) {
        return CircuitBreakerConfig.builder()
            .failureThreshold(failureThreshold)
            .successThreshold(successThreshold)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .resetTimeout(Duration.ofSeconds(resetTimeoutSeconds));
    }
    
    private static Function<Throwable, ?> unavailable(String code, String message) {
        return error -> {
            throw new ServiceUnavailableException(code, message, error);
        };
    }
}
