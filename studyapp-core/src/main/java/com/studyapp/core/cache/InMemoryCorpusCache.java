package com.studyapp.core.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe TTL cache backed by a {@link ConcurrentHashMap}.
 * Expired entries are evicted lazily when they are next read.
 */
@Slf4j
public class InMemoryCorpusCache implements CorpusCache {
    
    private final ConcurrentHashMap<String, CacheEntry<?>> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;
    
    public InMemoryCorpusCache(Clock clock, Duration defaultTtl) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + defaultTtl);
        }
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }
    
    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        CacheEntry<?> entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isValidAt(clock.millis())) {
            // Only drop the entry we saw; a concurrent put may already have replaced it
            store.remove(key, entry);
            log.debug("[CACHE] Entry expired | key={}", key);
            return Optional.empty();
        }
        return Optional.ofNullable((T) entry.data());
    }
    
    @Override
    public <T> void put(String key, T value) {
        put(key, value, defaultTtl);
    }
    
    @Override
    public <T> void put(String key, T value, Duration ttl) {
        store.put(key, new CacheEntry<>(value, clock.millis(), ttl.toMillis()));
        log.debug("[CACHE] Stored entry | key={} | ttlSeconds={}", key, ttl.toSeconds());
    }
    
    @Override
    public void clear() {
        int dropped = store.size();
        store.clear();
        log.info("[CACHE] Corpus cache cleared | droppedEntries={}", dropped);
    }
    
    @Override
    public int size() {
        return store.size();
    }
}
