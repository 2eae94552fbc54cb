package com.chatbot.resilience.degradation;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU cache of last-known-good results, keyed by {@code service:cacheKey}.
 */
class FallbackCache {
    
    private final Map<String, Entry> entries;
    
    FallbackCache(int maxSize) {
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > maxSize;
            }
        };
    }
    
    static String key(String service, String cacheKey) {
        return service + ":" + cacheKey;
    }
    
    synchronized void put(String key, Object value, Instant storedAt) {
        entries.put(key, new Entry(value, storedAt));
    }
    
    synchronized Optional<Entry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }
    
    synchronized void clear() {
        entries.clear();
    }
    
    synchronized void clearService(String service) {
        String prefix = service + ":";
        entries.keySet().removeIf(key -> key.startsWith(prefix));
    }
    
    synchronized int size() {
        return entries.size();
    }
    
    record Entry(Object value, Instant storedAt) {
    }
}
